package com.kalshi.bot.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kalshi.bot.config.KalshiProperties;
import com.kalshi.bot.domain.ExchangePosition;
import com.kalshi.bot.domain.MarketPage;
import com.kalshi.bot.domain.MarketSnapshot;
import com.kalshi.bot.domain.OrderRequest;
import com.kalshi.bot.domain.OrderStatus;
import com.kalshi.bot.domain.OrderStatusReport;
import com.kalshi.bot.domain.Side;
import com.kalshi.bot.error.ExchangeRejectionException;
import com.kalshi.bot.error.TransientChannelException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * REST client for the Kalshi trade API v2.
 */
@Slf4j
@Service
public class KalshiApiClient implements ExchangeTransport {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final KalshiRequestSigner signer;

    public KalshiApiClient(ObjectMapper objectMapper, KalshiProperties properties) {
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(properties.getBaseUrl());
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .retryOnConnectionFailure(true)
                .build();

        if (!properties.getApiKeyId().isBlank() && !properties.getPrivateKeyPath().isBlank()) {
            this.signer = KalshiRequestSigner.fromPemFile(properties.getApiKeyId(),
                    Path.of(properties.getPrivateKeyPath()));
            log.info("API key loaded: {}", properties.getApiKeyId());
        } else {
            this.signer = null;
            log.warn("No API key configured. Only public market data endpoints will work; run with trading.dry-run=true.");
        }
    }

    @Override
    public BigDecimal getBalance() {
        JsonNode root = execute("GET", url("portfolio", "balance"), null);
        return new BigDecimal(root.path("balance").asText("0"));
    }

    @Override
    public MarketPage listMarkets(String cursor, int limit) {
        HttpUrl.Builder url = baseUrl.newBuilder()
                .addPathSegment("markets")
                .addQueryParameter("status", "open")
                .addQueryParameter("limit", String.valueOf(limit));
        if (cursor != null && !cursor.isEmpty()) {
            url.addQueryParameter("cursor", cursor);
        }
        JsonNode root = execute("GET", url.build(), null);
        List<MarketSnapshot> markets = new ArrayList<>();
        for (JsonNode node : root.path("markets")) {
            markets.add(parseMarket(node));
        }
        String next = root.path("cursor").asText("");
        return new MarketPage(markets, next);
    }

    @Override
    public List<ExchangePosition> getPositions() {
        List<ExchangePosition> positions = new ArrayList<>();
        String cursor = "";
        do {
            HttpUrl.Builder url = baseUrl.newBuilder()
                    .addPathSegments("portfolio/positions")
                    .addQueryParameter("settlement_status", "unsettled")
                    .addQueryParameter("limit", "100");
            if (!cursor.isEmpty()) {
                url.addQueryParameter("cursor", cursor);
            }
            JsonNode root = execute("GET", url.build(), null);
            for (JsonNode node : root.path("market_positions")) {
                ExchangePosition position = parsePosition(node);
                if (position != null) {
                    positions.add(position);
                }
            }
            cursor = root.path("cursor").asText("");
        } while (!cursor.isEmpty());
        return positions;
    }

    @Override
    public MarketSnapshot getMarket(String marketId) {
        JsonNode root = execute("GET", url("markets", marketId), null);
        return parseMarket(root.path("market"));
    }

    @Override
    public String submitOrder(OrderRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("ticker", request.getMarketId());
        payload.put("client_order_id", request.getClientOrderId());
        payload.put("side", request.getSide().wireValue());
        payload.put("action", request.getAction().wireValue());
        payload.put("count", request.getQuantity());
        payload.put("type", "limit");
        payload.put(request.getSide() == Side.YES ? "yes_price" : "no_price", request.getPriceCents());

        JsonNode root = execute("POST", url("portfolio", "orders"), payload);
        String orderId = root.path("order").path("order_id").asText("");
        if (orderId.isEmpty()) {
            throw new ExchangeRejectionException("Order response carried no order_id: " + root, 200);
        }
        return orderId;
    }

    @Override
    public OrderStatusReport getOrder(String orderId) {
        JsonNode root = execute("GET", url("portfolio", "orders", orderId), null);
        return parseOrder(root.path("order"));
    }

    @Override
    public void cancelOrder(String orderId) {
        execute("DELETE", url("portfolio", "orders", orderId), null);
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private JsonNode execute(String method, HttpUrl url, JsonNode body) {
        Request.Builder request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json");
        try {
            RequestBody requestBody = body == null ? null
                    : RequestBody.create(objectMapper.writeValueAsString(body), JSON);
            request.method(method, requestBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
        if (signer != null) {
            signer.headers(System.currentTimeMillis(), method, url.encodedPath()).forEach(request::header);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                int code = response.code();
                String message = "API " + method + " " + url.encodedPath() + " failed: " + code + " " + text;
                if (code == 429 || code == 401 || code >= 500) {
                    throw new TransientChannelException(message, code, null);
                }
                throw new ExchangeRejectionException(message, code);
            }
            return text.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            throw new TransientChannelException("I/O error calling " + method + " " + url.encodedPath(), e);
        }
    }

    MarketSnapshot parseMarket(JsonNode node) {
        String status = node.path("status").asText("");
        return MarketSnapshot.builder()
                .marketId(node.path("ticker").asText())
                .eventId(node.path("event_ticker").asText(null))
                .title(node.path("title").asText(node.path("ticker").asText()))
                .open("open".equals(status) || "active".equals(status))
                .yesBid(node.path("yes_bid").asInt(0))
                .yesAsk(node.path("yes_ask").asInt(0))
                .noBid(node.path("no_bid").asInt(0))
                .noAsk(node.path("no_ask").asInt(0))
                .lastPrice(node.path("last_price").asInt(0))
                .volume(node.path("volume").asLong(0))
                .liquidityCents(new BigDecimal(node.path("liquidity").asText("0")))
                .closeTime(parseInstant(node.path("close_time").asText(null)))
                .lastUpdated(Instant.now())
                .build();
    }

    /** Signed position: positive holds YES, negative holds NO. Flat and settled entries are dropped. */
    ExchangePosition parsePosition(JsonNode node) {
        int signed = node.path("position").asInt(0);
        String result = node.path("market_result").asText("");
        if (signed == 0 || "yes".equals(result) || "no".equals(result)) {
            return null;
        }
        return ExchangePosition.builder()
                .marketId(node.path("ticker").asText())
                .side(signed > 0 ? Side.YES : Side.NO)
                .quantity(Math.abs(signed))
                .costCents(new BigDecimal(node.path("market_exposure").asText("0")).abs())
                .build();
    }

    OrderStatusReport parseOrder(JsonNode node) {
        int filled;
        if (node.has("fill_count")) {
            filled = node.path("fill_count").asInt(0);
        } else {
            filled = node.path("taker_fill_count").asInt(0) + node.path("maker_fill_count").asInt(0);
        }
        long fillCost = node.path("taker_fill_cost").asLong(0) + node.path("maker_fill_cost").asLong(0);
        BigDecimal average = filled > 0 && fillCost > 0
                ? BigDecimal.valueOf(fillCost).divide(BigDecimal.valueOf(filled), 4, RoundingMode.HALF_EVEN)
                : null;

        return OrderStatusReport.builder()
                .orderId(node.path("order_id").asText())
                .status(mapStatus(node.path("status").asText(""), filled))
                .filledQuantity(filled)
                .averageFillPrice(average)
                .build();
    }

    private static OrderStatus mapStatus(String status, int filled) {
        switch (status) {
            case "executed":
                return OrderStatus.FILLED;
            case "canceled":
            case "cancelled":
                return OrderStatus.CANCELED;
            case "expired":
                return OrderStatus.EXPIRED;
            case "rejected":
                return OrderStatus.REJECTED;
            default: // resting, pending
                return filled > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.PENDING;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp {}", value);
            return null;
        }
    }
}
