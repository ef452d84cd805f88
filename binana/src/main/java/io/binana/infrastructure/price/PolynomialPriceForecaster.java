package io.binana.infrastructure.price;

import io.binana.application.port.output.ExchangeClient;
import io.binana.application.port.output.PriceSource;
import io.binana.application.service.FetchException;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Short-horizon price forecast from recent trades.
 *
 * Fits a degree-5 least-squares polynomial to the last 50 aggregate trade prices,
 * indexed 0..49 oldest first, and evaluates it two steps past the newest trade (x = 51).
 * The fit can extrapolate to a non-positive value on a steep move; that is reported as
 * a fetch failure rather than used.
 */
public final class PolynomialPriceForecaster implements PriceSource {
    private static final Logger log = LoggerFactory.getLogger(PolynomialPriceForecaster.class);

    static final int DEGREE = 5;
    static final int TRADE_COUNT = 50;
    static final int FORECAST_X = 51;
    private static final int SCALE = 8;

    private final ExchangeClient exchangeClient;
    private final String quoteAsset;

    public PolynomialPriceForecaster(ExchangeClient exchangeClient, String quoteAsset) {
        this.exchangeClient = exchangeClient;
        this.quoteAsset = quoteAsset;
    }

    @Override
    public CompletableFuture<BigDecimal> getPrice(String symbol) {
        if (symbol.equals(quoteAsset)) {
            return CompletableFuture.completedFuture(BigDecimal.ONE);
        }
        return exchangeClient.getRecentTradePrices(symbol, TRADE_COUNT)
            .thenApply(prices -> forecast(symbol, prices));
    }

    @Override
    public String getName() {
        return "FORECAST";
    }

    static BigDecimal forecast(String symbol, List<BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            throw new FetchException(symbol, "no recent trades to forecast from");
        }

        WeightedObservedPoints points = new WeightedObservedPoints();
        for (int x = 0; x < prices.size(); x++) {
            points.add(x, prices.get(x).doubleValue());
        }

        // fewer points than coefficients would leave the fit underdetermined
        int degree = Math.min(DEGREE, prices.size() - 1);
        double[] coefficients = PolynomialCurveFitter.create(degree).fit(points.toList());
        double predicted = new PolynomialFunction(coefficients).value(FORECAST_X);

        if (Double.isNaN(predicted) || predicted <= 0) {
            throw new FetchException(symbol, "forecast is not a positive price: " + predicted);
        }

        BigDecimal price = BigDecimal.valueOf(predicted).setScale(SCALE, RoundingMode.HALF_UP);
        log.info("[PolynomialPriceForecaster] Predicted price for {}: {} (last trade {})",
            symbol, price.toPlainString(), prices.get(prices.size() - 1).toPlainString());
        return price;
    }
}
