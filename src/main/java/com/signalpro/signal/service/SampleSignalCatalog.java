package com.signalpro.signal.service;

import com.signalpro.chart.model.ChartPattern;
import com.signalpro.signal.model.BorderVariant;
import com.signalpro.signal.model.KeyStatistic;
import com.signalpro.signal.model.PriorityLevel;
import com.signalpro.signal.model.SignalKind;
import com.signalpro.signal.model.SignalRecord;
import com.signalpro.signal.model.StrategyNote;

import java.util.List;

/**
 * 範例訊號套組：每個訊號類別各一則
 *
 * 走勢圖在產生時才合成，這裡只記錄形狀與自訂 eventLabel（null = 預設標籤）。
 */
public final class SampleSignalCatalog {

    public record SampleSignal(SignalRecord signal, ChartPattern pattern, String eventLabel) {
    }

    private SampleSignalCatalog() {
    }

    public static List<SampleSignal> all() {
        return List.of(
                new SampleSignal(SignalRecord.builder()
                        .ticker("CRCL").displayName("Circle Internet Group").kind(SignalKind.IPO_DEBUT)
                        .priority(PriorityLevel.HOT)
                        .currentPrice(69.00).priceChangeAbsolute(38.00).priceChangePercent(122.6)
                        .keyStatistics(List.of(
                                new KeyStatistic("223%", "Day 1 High", true),
                                new KeyStatistic("$6.8B", "Valuation", false),
                                new KeyStatistic("46M", "Volume", false)))
                        .strategy(StrategyNote.builder()
                                .title("Hot IPO Momentum Play")
                                .description("Stablecoin leader tripled on debut with heavy institutional buying. "
                                        + "Wait for a dip to $60-65 before entering and expect volatility.")
                                .linkText("IPO playbook →")
                                .linkUrl("https://example.com/ipo-trading-strategy")
                                .build())
                        .timestampLabel("15 min ago")
                        .build(), ChartPattern.BREAKOUT, "IPO $69 → peak"),

                new SampleSignal(SignalRecord.builder()
                        .ticker("BTC").displayName("Bitcoin 150K Moonshot").kind(SignalKind.YOLO_CALLS)
                        .currentPrice(105456.00).priceChangeAbsolute(3850.00).priceChangePercent(3.8)
                        .keyStatistics(List.of(
                                new KeyStatistic("250%", "Max Gain", true),
                                new KeyStatistic("-100%", "Max Loss", false),
                                new KeyStatistic("$850", "Per Call", false)))
                        .strategy(StrategyNote.builder()
                                .title("Dec 150K Call Options")
                                .description("Prediction markets price 75% odds of 150K by Q4. Buy $130K calls "
                                        + "for December. High risk, only size what you can lose.")
                                .linkText("View odds →")
                                .linkUrl("https://kalshi.com/markets/kxbtcmax150")
                                .build())
                        .timestampLabel("1 hour ago")
                        .riskStyleEnabled(true)
                        .build(), ChartPattern.MOMENTUM, "Kalshi 75% → 150K"),

                new SampleSignal(SignalRecord.builder()
                        .ticker("NVDA").displayName("Nvidia Pre-Market Surge").kind(SignalKind.PRE_MARKET)
                        .currentPrice(1125.50).priceChangeAbsolute(55.50).priceChangePercent(5.2)
                        .keyStatistics(List.of(
                                new KeyStatistic("+6.8%", "Pre-Mkt", true),
                                new KeyStatistic("2.5M", "Volume", false),
                                new KeyStatistic("9:28", "Entry", false)))
                        .strategy(StrategyNote.builder()
                                .title("Pre-Market Gap & Go")
                                .description("Supplier production news lifted the stock 6.8% pre-market on heavy "
                                        + "volume. Buy 9:28-9:30 for opening momentum, stop at the pre-market low.")
                                .linkText("Pre-market guide →")
                                .linkUrl("https://example.com/premarket-trading")
                                .build())
                        .timestampLabel("Pre-market")
                        .borderVariant(BorderVariant.DASHED)
                        .build(), ChartPattern.BREAKOUT, "Taiwan news 4AM"),

                new SampleSignal(SignalRecord.builder()
                        .ticker("AMZN").displayName("Amazon Split Announced").kind(SignalKind.STOCK_SPLIT)
                        .currentPrice(3245.00).priceChangeAbsolute(245.00).priceChangePercent(8.2)
                        .keyStatistics(List.of(
                                new KeyStatistic("20:1", "Ratio", false),
                                new KeyStatistic("+15%", "Avg Run", true),
                                new KeyStatistic("28d", "To Split", false)))
                        .strategy(StrategyNote.builder()
                                .title("Pre-Split Momentum")
                                .description("20:1 split announced. Past splits averaged a 15% gain from "
                                        + "announcement to split date. Buy shares or August calls.")
                                .linkText("Split history →")
                                .linkUrl("https://example.com/stock-split-strategy")
                                .build())
                        .timestampLabel("2 hours ago")
                        .build(), ChartPattern.MOMENTUM, null),

                new SampleSignal(SignalRecord.builder()
                        .ticker("TSLA").displayName("Tesla Iron Condor").kind(SignalKind.CREDIT_SPREAD)
                        .currentPrice(245.80).priceChangeAbsolute(-2.85).priceChangePercent(-1.2)
                        .keyStatistics(List.of(
                                new KeyStatistic("$3.20", "Credit", false),
                                new KeyStatistic("72%", "PoP", true),
                                new KeyStatistic("21d", "DTE", false)))
                        .strategy(StrategyNote.builder()
                                .title("Sell 240/235 Put Spread")
                                .description("Post-earnings IV crush. Sell the 240/235 put spread for a $3.20 "
                                        + "credit, 72% probability of profit, max loss $180.")
                                .linkText("Spread calculator →")
                                .linkUrl("https://example.com/credit-spreads")
                                .build())
                        .timestampLabel("3 hours ago")
                        .build(), ChartPattern.VOLATILE, null),

                new SampleSignal(SignalRecord.builder()
                        .ticker("ETH").displayName("Ethereum Staking Play").kind(SignalKind.CRYPTO_YIELD)
                        .currentPrice(3856.00).priceChangeAbsolute(166.00).priceChangePercent(4.5)
                        .keyStatistics(List.of(
                                new KeyStatistic("5.2%", "APY", true),
                                new KeyStatistic("$4.2K", "Target", false),
                                new KeyStatistic("85", "RSI", false)))
                        .strategy(StrategyNote.builder()
                                .title("Stake & Trade Momentum")
                                .description("Staking yields 5.2% on top of price appreciation. Buy spot or the "
                                        + "trust while DeFi TVL keeps climbing.")
                                .linkText("Staking guide →")
                                .linkUrl("https://example.com/eth-staking")
                                .build())
                        .timestampLabel("4 hours ago")
                        .build(), ChartPattern.MOMENTUM, null),

                new SampleSignal(SignalRecord.builder()
                        .ticker("SAVA").displayName("Cassava Sciences").kind(SignalKind.FDA_EVENT)
                        .currentPrice(42.15).priceChangeAbsolute(4.65).priceChangePercent(12.3)
                        .keyStatistics(List.of(
                                new KeyStatistic("+180%", "If Pass", true),
                                new KeyStatistic("-65%", "If Fail", false),
                                new KeyStatistic("220%", "IV", false)))
                        .strategy(StrategyNote.builder()
                                .title("Binary FDA Event")
                                .description("PDUFA date 7/28. Out-of-the-money calls carry 10x potential and a "
                                        + "real chance of total loss. Size accordingly.")
                                .linkText("FDA calendar →")
                                .linkUrl("https://example.com/fda-calendar")
                                .build())
                        .timestampLabel("5 hours ago")
                        .riskStyleEnabled(true)
                        .build(), ChartPattern.VOLATILE, "FDA 7/28"),

                new SampleSignal(SignalRecord.builder()
                        .ticker("GOOGL").displayName("Google Post-Earnings").kind(SignalKind.EARNINGS)
                        .currentPrice(178.25).priceChangeAbsolute(13.96).priceChangePercent(8.5)
                        .keyStatistics(List.of(
                                new KeyStatistic("+11%", "AH Move", true),
                                new KeyStatistic("$185", "Target", false),
                                new KeyStatistic("5.2M", "AH Vol", false)))
                        .strategy(StrategyNote.builder()
                                .title("Post-Earnings Momentum")
                                .description("Beat and raised guidance, up 11% after hours. Buy the open for "
                                        + "continuation; 3-day drift after beats averages +5%.")
                                .linkText("ER playbook →")
                                .linkUrl("https://example.com/earnings-momentum")
                                .build())
                        .timestampLabel("After hours")
                        .build(), ChartPattern.MOMENTUM, null),

                new SampleSignal(SignalRecord.builder()
                        .ticker("AMD").displayName("Unusual Call Buying").kind(SignalKind.UNUSUAL_OPTIONS)
                        .priority(PriorityLevel.WATCH)
                        .currentPrice(185.40).priceChangeAbsolute(3.85).priceChangePercent(2.1)
                        .keyStatistics(List.of(
                                new KeyStatistic("$2.5M", "Premium", false),
                                new KeyStatistic("10x", "Avg Vol", false),
                                new KeyStatistic("$200", "Strike", false)))
                        .strategy(StrategyNote.builder()
                                .title("Follow the Smart Money")
                                .description("10,000 August $200 calls bought for $2.5M at 10x normal volume. "
                                        + "Follow with a smaller position or a spread.")
                                .linkText("Flow data →")
                                .linkUrl("https://example.com/options-flow")
                                .build())
                        .timestampLabel("30 min ago")
                        .build(), ChartPattern.MOMENTUM, null),

                new SampleSignal(SignalRecord.builder()
                        .ticker("GME").displayName("GameStop Gamma Ramp").kind(SignalKind.MEME_SQUEEZE)
                        .currentPrice(45.20).priceChangeAbsolute(11.78).priceChangePercent(35.2)
                        .keyStatistics(List.of(
                                new KeyStatistic("140%", "Short %", false),
                                new KeyStatistic("+420%", "Target", true),
                                new KeyStatistic("💎🙌", "Hands", false)))
                        .strategy(StrategyNote.builder()
                                .title("Diamond Hands Squeeze Play")
                                .description("Short interest 140% with an 85% borrow fee and a gamma ramp "
                                        + "building. Lottery ticket only, not investment advice. 🚀")
                                .linkText("Join the thread →")
                                .linkUrl("https://reddit.com/r/wallstreetbets")
                                .build())
                        .timestampLabel("TO THE MOON!")
                        .riskStyleEnabled(true)
                        .build(), ChartPattern.VOLATILE, null)
        );
    }
}
