package org.nowstart.perpbot.service.exchange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.AccountBalance;
import org.nowstart.perpbot.data.dto.AssetMeta;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.dto.OrderResult;
import org.nowstart.perpbot.data.dto.TpSlConfig;
import org.nowstart.perpbot.data.exception.ExchangeRequestException;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.TradeSide;

/**
 * Virtual fills at the current mid against real market data. Margin is notional / leverage and
 * realized PnL is credited to the balance on close.
 */
@Slf4j
public class PaperExchangeGateway implements ExchangeGateway {

    private final HyperliquidInfoService infoService;
    private final Map<String, OpenPosition> positions = new LinkedHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();

    private double balance;
    private double marginUsed;

    public PaperExchangeGateway(HyperliquidInfoService infoService, double initialBalance) {
        this.infoService = infoService;
        this.balance = initialBalance;
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.PAPER;
    }

    @Override
    public synchronized List<OpenPosition> fetchPositions() {
        return new ArrayList<>(positions.values());
    }

    @Override
    public synchronized AccountBalance fetchBalance() {
        double available = Math.max(balance - marginUsed, 0.0);
        return new AccountBalance(available, balance, marginUsed);
    }

    @Override
    public synchronized OrderResult placeMarketOrder(
            String coin,
            TradeSide side,
            double size,
            int leverage,
            int slippageBps,
            TpSlConfig tpSl
    ) {
        if (positions.containsKey(coin)) {
            throw new ExchangeRequestException(coin, "Paper position already open for " + coin);
        }
        double price = infoService.midPrice(coin);
        double margin = size * price / leverage;
        if (margin > balance - marginUsed) {
            throw new ExchangeRequestException(coin, "Insufficient paper balance for " + coin);
        }

        positions.put(coin, new OpenPosition(coin, side, size, price, leverage));
        marginUsed += margin;
        String orderId = "paper-" + orderSequence.incrementAndGet();
        log.info(
                "event=paper_fill coin={} side={} size={} price={} leverage={} orderId={}",
                coin,
                side.wireName(),
                size,
                price,
                leverage,
                orderId
        );
        return new OrderResult(coin, "filled", orderId, size, price);
    }

    @Override
    public synchronized OrderResult closePosition(String coin) {
        OpenPosition position = positions.get(coin);
        if (position == null) {
            throw new ExchangeRequestException(coin, "No paper position for " + coin);
        }
        // position stays open until the fill price is known
        double price = infoService.midPrice(coin);
        positions.remove(coin);
        double pnl = position.unrealizedPnl(price);
        marginUsed = Math.max(marginUsed - position.notional() / position.leverage(), 0.0);
        balance += pnl;
        String orderId = "paper-" + orderSequence.incrementAndGet();
        log.info("event=paper_close coin={} price={} pnl={} balance={}", coin, price, pnl, balance);
        return new OrderResult(coin, "filled", orderId, position.size(), price);
    }

    @Override
    public void cancelOpenOrders(String coin) {
        // paper mode never rests orders
    }

    /**
     * Drops every virtual position without realizing PnL.
     */
    @Override
    public synchronized List<String> closeAllPositions() {
        List<String> coins = new ArrayList<>(positions.keySet());
        positions.clear();
        marginUsed = 0.0;
        return coins;
    }

    @Override
    public double midPrice(String coin) {
        return infoService.midPrice(coin);
    }

    @Override
    public Optional<AssetMeta> assetMeta(String coin) {
        return infoService.assetMeta(coin);
    }
}
