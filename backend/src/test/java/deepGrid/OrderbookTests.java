package deepGrid;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class OrderbookTests {

    private static final PriceScale SCALE = PriceScale.DEFAULT;
    private static final long ONE = WideMath.FLOAT_SCALING;

    private enum ActionType {
        Add,
        CancelAll,
        Trade
    }

    private record Information(ActionType type, OrderSide side, long price, long size, String owner, boolean up) {
    }

    private record Result(int allCount, int bidCount, int askCount, long pendingBase, long pendingQuote, long midPrice) {
    }

    private record ParsedData(long initialMid, List<Information> actions, Result result) {
    }

    private static final class InputHandler {

        ParsedData getInformations(String fileName) {
            List<Information> actions = new ArrayList<>(16);
            Long initialMid = null;
            Result result = null;

            try (BufferedReader reader = openReader(fileName)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.trim();
                    if (line.isEmpty()) {
                        continue;
                    }

                    char code = Character.toUpperCase(line.charAt(0));
                    if (code == 'M') {
                        if (initialMid != null) {
                            throw new IllegalStateException("Mid price should only be specified once.");
                        }
                        initialMid = SCALE.toScaled(split(line)[1]);
                        continue;
                    }
                    if (code == 'R') {
                        result = parseResult(line);
                        ensureNoContentRemains(reader);
                        break;
                    }

                    actions.add(parseInformation(line));
                }
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read test file.", ex);
            }

            if (initialMid == null) {
                throw new IllegalStateException("No initial mid price specified.");
            }
            if (result == null) {
                throw new IllegalStateException("No result specified.");
            }
            return new ParsedData(initialMid, List.copyOf(actions), result);
        }

        private BufferedReader openReader(String fileName) {
            String resource = "/TestFiles/" + fileName;
            InputStream stream = OrderbookTests.class.getResourceAsStream(resource);
            if (stream == null) {
                throw new IllegalArgumentException("Missing test file: " + resource);
            }
            return new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        }

        private void ensureNoContentRemains(BufferedReader reader) throws IOException {
            String trailing;
            while ((trailing = reader.readLine()) != null) {
                if (!trailing.trim().isEmpty()) {
                    throw new IllegalStateException("Result should only be specified at the end.");
                }
            }
        }

        private Information parseInformation(String line) {
            String[] tokens = split(line);
            char code = Character.toUpperCase(tokens[0].charAt(0));

            if (code == 'A') {
                OrderSide side = parseSide(tokens[1]);
                long price = SCALE.toScaled(tokens[2]);
                long size = SCALE.toScaled(tokens[3]);
                return new Information(ActionType.Add, side, price, size, tokens[4], false);
            }

            if (code == 'C') {
                return new Information(ActionType.CancelAll, null, 0L, 0L, tokens[1], false);
            }

            if (code == 'T') {
                boolean up = parseDirection(tokens[1]);
                long delta = SCALE.toScaled(tokens[2]);
                return new Information(ActionType.Trade, null, delta, 0L, null, up);
            }

            throw new IllegalStateException("Unsupported action type: " + tokens[0]);
        }

        private Result parseResult(String line) {
            String[] tokens = split(line);
            if (tokens.length < 7) {
                throw new IllegalStateException("Invalid result line: " + line);
            }
            return new Result(
                    Integer.parseInt(tokens[1]),
                    Integer.parseInt(tokens[2]),
                    Integer.parseInt(tokens[3]),
                    SCALE.toScaled(tokens[4]),
                    SCALE.toScaled(tokens[5]),
                    SCALE.toScaled(tokens[6]));
        }

        private String[] split(String line) {
            return line.split("\\s+");
        }

        private OrderSide parseSide(String token) {
            return switch (token.toUpperCase(Locale.ROOT)) {
                case "B" -> OrderSide.BID;
                case "S" -> OrderSide.ASK;
                default -> throw new IllegalStateException("Unknown side: " + token);
            };
        }

        private boolean parseDirection(String token) {
            return switch (token.toUpperCase(Locale.ROOT)) {
                case "U" -> true;
                case "D" -> false;
                default -> throw new IllegalStateException("Unknown direction: " + token);
            };
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Trade_Up_FillsAsks.txt",
            "Trade_Up_Partial.txt",
            "Trade_Down_FillsBids.txt",
            "Trade_Down_Clamp.txt",
            "Trade_Zero_Delta.txt",
            "Trade_Sequence.txt",
            "Cancel_Owner.txt",
    })
    void orderbookTestSuite(String fileName) {
        InputHandler handler = new InputHandler();
        ParsedData parsed = handler.getInformations(fileName);

        Orderbook orderbook = new Orderbook("book-test", parsed.initialMid());
        for (Information action : parsed.actions()) {
            switch (action.type()) {
                case Add -> orderbook.place(action.side(), action.price(), action.size(), action.owner());
                case CancelAll -> orderbook.cancelAll(action.owner());
                case Trade -> orderbook.simulateTrade(action.up(), action.price());
                default -> throw new IllegalStateException("Unsupported action: " + action.type());
            }
        }

        Result expected = parsed.result();
        Assertions.assertEquals(expected.allCount(), orderbook.size(), "Unexpected order count");
        Assertions.assertEquals(expected.bidCount(), orderbook.getBids().size(), "Unexpected bid count");
        Assertions.assertEquals(expected.askCount(), orderbook.getAsks().size(), "Unexpected ask count");
        Assertions.assertEquals(expected.pendingBase(), orderbook.getPendingFillBase(), "Unexpected pending base");
        Assertions.assertEquals(expected.pendingQuote(), orderbook.getPendingFillQuote(), "Unexpected pending quote");
        Assertions.assertEquals(expected.midPrice(), orderbook.getMidPrice(), "Unexpected mid price");
    }

    @Test
    void takePendingFillsDrainsAccumulators() {
        Orderbook orderbook = new Orderbook("book-test", 10 * ONE);
        orderbook.place(OrderSide.ASK, 10_100_000_000L, ONE, "vault-1");
        orderbook.simulateTrade(true, 500_000_000L);

        PendingFills first = orderbook.takePendingFills();
        Assertions.assertEquals(0L, first.base());
        Assertions.assertEquals(10_100_000_000L, first.quote());

        PendingFills second = orderbook.takePendingFills();
        Assertions.assertEquals(0L, second.base());
        Assertions.assertEquals(0L, second.quote());
        Assertions.assertEquals(0L, orderbook.getPendingFillQuote());
    }

    @Test
    void tradeEventReportsFillCounts() {
        Orderbook orderbook = new Orderbook("book-test", 10 * ONE);
        orderbook.place(OrderSide.BID, 9_900_000_000L, 2 * ONE, "vault-1");
        orderbook.place(OrderSide.BID, 9_000_000_000L, ONE, "vault-1");

        TradeSimulatedEvent event = orderbook.simulateTrade(false, 200_000_000L);

        Assertions.assertEquals("book-test", event.bookId());
        Assertions.assertEquals(10 * ONE, event.oldMidPrice());
        Assertions.assertEquals(9_800_000_000L, event.newMidPrice());
        Assertions.assertEquals(1, event.bidsFilled());
        Assertions.assertEquals(0, event.asksFilled());
        Assertions.assertEquals(2 * ONE, event.bidFillBase());
        Assertions.assertEquals(0L, event.quoteEarned());
    }

    @Test
    void orderIdsIncreaseAcrossSides() {
        Orderbook orderbook = new Orderbook("book-test", 10 * ONE);
        long first = orderbook.place(OrderSide.BID, 9 * ONE, ONE, "vault-1");
        long second = orderbook.place(OrderSide.ASK, 11 * ONE, ONE, "vault-1");

        Assertions.assertTrue(second > first);
        Assertions.assertEquals(2, orderbook.getOrdersFor("vault-1").size());
        Assertions.assertTrue(orderbook.getOrdersFor("vault-2").isEmpty());
    }

    @Test
    void rejectsNonPositiveInitialMid() {
        ProtocolException ex = Assertions.assertThrows(ProtocolException.class,
                () -> new Orderbook("book-test", 0L));
        Assertions.assertEquals(ErrorCode.INVALID_AMOUNT, ex.getCode());
    }
}
