package org.nowstart.perpbot.service.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.AccountBalance;
import org.nowstart.perpbot.data.dto.AssetMeta;
import org.nowstart.perpbot.data.dto.HyperliquidClearinghouseStateResponse;
import org.nowstart.perpbot.data.dto.HyperliquidExchangeResponse;
import org.nowstart.perpbot.data.dto.HyperliquidInfoRequest;
import org.nowstart.perpbot.data.dto.HyperliquidOpenOrderResponse;
import org.nowstart.perpbot.data.dto.HyperliquidSpotStateResponse;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.dto.OrderResult;
import org.nowstart.perpbot.data.dto.TpSlConfig;
import org.nowstart.perpbot.data.exception.ExchangeRequestException;
import org.nowstart.perpbot.data.property.ExchangeProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.repository.HyperliquidFeignClient;
import org.nowstart.perpbot.service.auth.HyperliquidActionSigner;

@Slf4j
@RequiredArgsConstructor
public class HyperliquidExchangeGateway implements ExchangeGateway {

    private static final String USDC = "USDC";

    private final HyperliquidFeignClient hyperliquidFeignClient;
    private final HyperliquidInfoService infoService;
    private final HyperliquidActionSigner signer;
    private final ExchangeProperties exchangeProperties;
    private final Clock clock;

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.LIVE;
    }

    @Override
    public List<OpenPosition> fetchPositions() {
        HyperliquidClearinghouseStateResponse state = clearinghouseState();
        List<OpenPosition> positions = new ArrayList<>();
        if (state == null || state.assetPositions() == null) {
            return positions;
        }
        for (HyperliquidClearinghouseStateResponse.AssetPosition assetPosition : state.assetPositions()) {
            HyperliquidClearinghouseStateResponse.Position position = assetPosition.position();
            if (position == null) {
                continue;
            }
            double signedSize = parseOrZero(position.szi());
            if (signedSize == 0) {
                continue;
            }
            positions.add(new OpenPosition(
                    position.coin(),
                    TradeSide.fromSignedSize(signedSize),
                    Math.abs(signedSize),
                    parseOrZero(position.entryPx()),
                    position.leverage() == null ? 1 : position.leverage().value()
            ));
        }
        return positions;
    }

    @Override
    public AccountBalance fetchBalance() {
        HyperliquidClearinghouseStateResponse state = clearinghouseState();
        double withdrawable = state == null ? 0.0 : parseOrZero(state.withdrawable());
        double accountValue = 0.0;
        double marginUsed = 0.0;
        if (state != null && state.marginSummary() != null) {
            accountValue = parseOrZero(state.marginSummary().accountValue());
            marginUsed = parseOrZero(state.marginSummary().totalMarginUsed());
        }

        // unified accounts keep perp collateral in the spot USDC balance
        HyperliquidSpotStateResponse spot = hyperliquidFeignClient.getSpotState(
                HyperliquidInfoRequest.spotClearinghouseState(exchangeProperties.accountAddress())
        );
        double spotTotal = 0.0;
        if (spot != null && spot.balances() != null) {
            spotTotal = spot.balances().stream()
                    .filter(balance -> USDC.equals(balance.coin()))
                    .mapToDouble(balance -> parseOrZero(balance.total()))
                    .sum();
        }
        double available = Math.max(withdrawable, spotTotal > 0 ? spotTotal - marginUsed : 0.0);
        return new AccountBalance(Math.max(available, 0.0), Math.max(accountValue, spotTotal), marginUsed);
    }

    @Override
    public OrderResult placeMarketOrder(
            String coin,
            TradeSide side,
            double size,
            int leverage,
            int slippageBps,
            TpSlConfig tpSl
    ) {
        AssetMeta meta = requireMeta(coin);
        submit(coin, updateLeverageAction(meta.assetId(), leverage));

        double mid = infoService.midPrice(coin);
        double limitPrice = HyperliquidWireFormat.slippagePrice(mid, side.isBuy(), slippageBps);
        Map<String, Object> order = orderWire(meta, side.isBuy(), limitPrice, size, false, iocType());
        OrderResult result = parseOrderStatus(coin, submit(coin, orderAction(order)));
        log.info(
                "event=live_order coin={} side={} size={} limitPx={} status={} orderId={}",
                coin,
                side.wireName(),
                size,
                limitPrice,
                result.status(),
                result.orderId()
        );

        if (tpSl != null) {
            placeProtectiveOrders(meta, side, size, mid, tpSl);
        }
        return result;
    }

    @Override
    public OrderResult closePosition(String coin) {
        OpenPosition position = fetchPositions().stream()
                .filter(candidate -> candidate.coin().equals(coin))
                .findFirst()
                .orElseThrow(() -> new ExchangeRequestException(coin, "No open position for " + coin));
        AssetMeta meta = requireMeta(coin);
        boolean buy = position.side().opposite().isBuy();
        double limitPrice = HyperliquidWireFormat.slippagePrice(
                infoService.midPrice(coin),
                buy,
                exchangeProperties.slippageBps()
        );
        Map<String, Object> order = orderWire(meta, buy, limitPrice, position.size(), true, iocType());
        return parseOrderStatus(coin, submit(coin, orderAction(order)));
    }

    @Override
    public void cancelOpenOrders(String coin) {
        List<HyperliquidOpenOrderResponse> openOrders = hyperliquidFeignClient.getOpenOrders(
                HyperliquidInfoRequest.openOrders(exchangeProperties.accountAddress())
        );
        if (openOrders == null) {
            return;
        }
        List<HyperliquidOpenOrderResponse> forCoin = openOrders.stream()
                .filter(order -> coin.equals(order.coin()))
                .toList();
        if (forCoin.isEmpty()) {
            return;
        }

        AssetMeta meta = requireMeta(coin);
        List<Map<String, Object>> cancels = new ArrayList<>();
        for (HyperliquidOpenOrderResponse order : forCoin) {
            Map<String, Object> cancel = new LinkedHashMap<>();
            cancel.put("a", meta.assetId());
            cancel.put("o", order.oid());
            cancels.add(cancel);
        }
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "cancel");
        action.put("cancels", cancels);
        submit(coin, action);
        log.info("event=orders_cancelled coin={} count={}", coin, cancels.size());
    }

    @Override
    public List<String> closeAllPositions() {
        List<String> closed = new ArrayList<>();
        for (OpenPosition position : fetchPositions()) {
            String coin = position.coin();
            try {
                cancelOpenOrders(coin);
                closePosition(coin);
                closed.add(coin);
            } catch (RuntimeException e) {
                log.error("event=emergency_close_failed coin={} reason={}", coin, e.getMessage(), e);
            }
        }
        return closed;
    }

    @Override
    public double midPrice(String coin) {
        return infoService.midPrice(coin);
    }

    @Override
    public Optional<AssetMeta> assetMeta(String coin) {
        return infoService.assetMeta(coin);
    }

    private void placeProtectiveOrders(AssetMeta meta, TradeSide side, double size, double mid, TpSlConfig tpSl) {
        boolean closeBuy = side.opposite().isBuy();
        double direction = side == TradeSide.LONG ? 1.0 : -1.0;
        double takeProfitPrice = mid * (1 + direction * tpSl.takeProfitPct());
        double stopLossPrice = mid * (1 + direction * tpSl.stopLossPct());
        placeTrigger(meta, closeBuy, size, takeProfitPrice, "tp");
        placeTrigger(meta, closeBuy, size, stopLossPrice, "sl");
    }

    private void placeTrigger(AssetMeta meta, boolean buy, double size, double triggerPrice, String kind) {
        try {
            Map<String, Object> trigger = new LinkedHashMap<>();
            trigger.put("isMarket", true);
            trigger.put("triggerPx", HyperliquidWireFormat.price(triggerPrice, meta.szDecimals()));
            trigger.put("tpsl", kind);
            Map<String, Object> orderType = new LinkedHashMap<>();
            orderType.put("trigger", trigger);
            parseOrderStatus(meta.name(), submit(meta.name(), orderAction(
                    orderWire(meta, buy, triggerPrice, size, true, orderType)
            )));
            log.info("event=protective_order coin={} kind={} triggerPx={}", meta.name(), kind, triggerPrice);
        } catch (RuntimeException e) {
            log.warn("event=protective_order_failed coin={} kind={} reason={}", meta.name(), kind, e.getMessage());
        }
    }

    private HyperliquidClearinghouseStateResponse clearinghouseState() {
        return hyperliquidFeignClient.getClearinghouseState(
                HyperliquidInfoRequest.clearinghouseState(exchangeProperties.accountAddress())
        );
    }

    private AssetMeta requireMeta(String coin) {
        return infoService.assetMeta(coin)
                .orElseThrow(() -> new ExchangeRequestException(coin, "Unknown asset " + coin));
    }

    private JsonNode submit(String coin, Map<String, Object> action) {
        HyperliquidExchangeResponse response = hyperliquidFeignClient.postExchange(
                signer.sign(action, clock.millis())
        );
        if (response == null || !response.ok()) {
            String detail = response == null || response.response() == null ? "empty response" : response.response().toString();
            throw new ExchangeRequestException(coin, "Exchange rejected " + action.get("type") + ": " + detail);
        }
        return response.response();
    }

    private static OrderResult parseOrderStatus(String coin, JsonNode response) {
        JsonNode statuses = response.path("data").path("statuses");
        if (!statuses.isArray() || statuses.isEmpty()) {
            throw new ExchangeRequestException(coin, "Exchange returned no order status");
        }
        JsonNode status = statuses.get(0);
        if (status.has("error")) {
            throw new ExchangeRequestException(coin, status.path("error").asText());
        }
        if (status.has("filled")) {
            JsonNode filled = status.path("filled");
            return new OrderResult(
                    coin,
                    "filled",
                    filled.path("oid").asText(),
                    filled.path("totalSz").asDouble(),
                    filled.path("avgPx").asDouble()
            );
        }
        if (status.has("resting")) {
            return new OrderResult(coin, "resting", status.path("resting").path("oid").asText(), 0.0, 0.0);
        }
        return new OrderResult(coin, status.asText(), null, 0.0, 0.0);
    }

    private static Map<String, Object> updateLeverageAction(int assetId, int leverage) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "updateLeverage");
        action.put("asset", assetId);
        action.put("isCross", true);
        action.put("leverage", leverage);
        return action;
    }

    private static Map<String, Object> orderAction(Map<String, Object> order) {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "order");
        action.put("orders", List.of(order));
        action.put("grouping", "na");
        return action;
    }

    private static Map<String, Object> orderWire(
            AssetMeta meta,
            boolean buy,
            double price,
            double size,
            boolean reduceOnly,
            Map<String, Object> orderType
    ) {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("a", meta.assetId());
        order.put("b", buy);
        order.put("p", HyperliquidWireFormat.price(price, meta.szDecimals()));
        order.put("s", HyperliquidWireFormat.size(size, meta.szDecimals()));
        order.put("r", reduceOnly);
        order.put("t", orderType);
        return order;
    }

    private static Map<String, Object> iocType() {
        Map<String, Object> limit = new LinkedHashMap<>();
        limit.put("tif", "Ioc");
        Map<String, Object> orderType = new LinkedHashMap<>();
        orderType.put("limit", limit);
        return orderType;
    }

    private static double parseOrZero(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        return Double.parseDouble(value);
    }
}
