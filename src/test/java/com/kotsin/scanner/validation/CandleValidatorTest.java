package com.kotsin.scanner.validation;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.model.CandleRejection;
import com.kotsin.scanner.model.CandleValidationResult;
import com.kotsin.scanner.model.RawCandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandleValidator")
class CandleValidatorTest {

    private CandleValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CandleValidator(ScannerTestFixtures.registry());
    }

    private static RawCandle raw(String open, String high, String low, String close, String volume) {
        return RawCandle.builder()
                .symbol(" SPY ")
                .interval("5m")
                .timestamp(1_700_000_000_000L)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }

    @Test
    @DisplayName("Well-formed candle is accepted and normalized")
    void testValidate_Accepts() {
        CandleValidationResult result = validator.validate(raw("100", "102", "99", "101", "1500"), null);

        assertTrue(result.isAccepted());
        assertEquals("SPY", result.getCandle().getSymbol());
        assertEquals(3.0, result.getCandle().getRange(), 1e-9);
        assertEquals(1500.0, result.getCandle().getVolume());
    }

    @Test
    @DisplayName("Missing volume is allowed")
    void testValidate_NoVolume() {
        CandleValidationResult result = validator.validate(raw("100", "102", "99", "101", null), null);

        assertTrue(result.isAccepted());
        assertFalse(result.getCandle().hasVolume());
    }

    @ParameterizedTest(name = "{0}/{1}/{2}/{3} -> {4}")
    @CsvSource({
            "abc, 102, 99, 101, NON_NUMERIC",
            "100, NaN, 99, 101, NON_NUMERIC",
            "100, Infinity, 99, 101, NON_NUMERIC",
            "100, 98, 99, 99, INVALID_OHLC",
            "103, 102, 99, 101, INVALID_OHLC",
            "100, 102, 99, 98, INVALID_OHLC",
            "-1, 102, 99, 101, INVALID_OHLC",
            "100, 100.005, 100, 100, SUB_MINIMUM_RANGE"
    })
    @DisplayName("Malformed candles are rejected with a reason")
    void testValidate_Rejections(String open, String high, String low, String close, CandleRejection expected) {
        CandleValidationResult result = validator.validate(raw(open, high, low, close, "100"), null);

        assertFalse(result.isAccepted());
        assertEquals(expected, result.getRejection());
    }

    @Test
    @DisplayName("Flat bar is invalid even when no minimum range is configured")
    void testValidate_FlatBarWithZeroMinimumRange() {
        CandleValidator lenient = new CandleValidator(
                ScannerTestFixtures.registry(props -> props.getHistory().setMinBarRange(0)));

        CandleValidationResult flat = lenient.validate(raw("100", "100", "100", "100", "100"), null);

        assertFalse(flat.isAccepted());
        assertEquals(CandleRejection.INVALID_OHLC, flat.getRejection());
        assertTrue(lenient.validate(raw("100", "100.001", "100", "100", "100"), null).isAccepted());
    }

    @Test
    @DisplayName("Negative volume is rejected")
    void testValidate_NegativeVolume() {
        CandleValidationResult result = validator.validate(raw("100", "102", "99", "101", "-5"), null);

        assertEquals(CandleRejection.NON_NUMERIC, result.getRejection());
    }

    @Test
    @DisplayName("Duplicate and older timestamps are out of order")
    void testValidate_OutOfOrder() {
        RawCandle candle = raw("100", "102", "99", "101", "100");

        assertEquals(CandleRejection.OUT_OF_ORDER, validator.validate(candle, candle.getTimestamp()).getRejection());
        assertEquals(CandleRejection.OUT_OF_ORDER,
                validator.validate(candle, candle.getTimestamp() + 1).getRejection());
        assertTrue(validator.validate(candle, candle.getTimestamp() - 1).isAccepted());
    }

    @Test
    @DisplayName("Null candle and blank symbol are rejected")
    void testValidate_NullAndBlank() {
        assertFalse(validator.validate(null, null).isAccepted());

        RawCandle blank = raw("100", "102", "99", "101", "100");
        blank.setSymbol("  ");
        assertEquals(CandleRejection.NON_NUMERIC, validator.validate(blank, null).getRejection());
    }
}
