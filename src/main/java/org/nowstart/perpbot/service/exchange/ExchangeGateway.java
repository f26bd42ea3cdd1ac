package org.nowstart.perpbot.service.exchange;

import java.util.List;
import java.util.Optional;
import org.nowstart.perpbot.data.dto.AccountBalance;
import org.nowstart.perpbot.data.dto.AssetMeta;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.dto.OrderResult;
import org.nowstart.perpbot.data.dto.TpSlConfig;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.TradeSide;

/**
 * Account and order operations used by the control loop. Every call may fail and is wrapped in retry by callers.
 */
public interface ExchangeGateway {

    ExecutionMode mode();

    List<OpenPosition> fetchPositions();

    AccountBalance fetchBalance();

    /**
     * @param tpSl optional exchange-side take profit and stop loss, {@code null} for none
     */
    OrderResult placeMarketOrder(String coin, TradeSide side, double size, int leverage, int slippageBps, TpSlConfig tpSl);

    OrderResult closePosition(String coin);

    void cancelOpenOrders(String coin);

    /**
     * Best-effort liquidation used by the circuit breaker. Individual failures are logged, not thrown.
     *
     * @return coins that were closed
     */
    List<String> closeAllPositions();

    double midPrice(String coin);

    Optional<AssetMeta> assetMeta(String coin);
}
