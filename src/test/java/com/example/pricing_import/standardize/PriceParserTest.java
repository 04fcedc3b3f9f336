package com.example.pricing_import.standardize;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

class PriceParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "1,234.56   | 1234.56",
            "1.234,56   | 1234.56",
            "$12.50     | 12.50",
            "$1,234     | 1234.00",
            "1.234 €    | 1234.00",
            "€1,234     | 1234.00",
            "12,5       | 12.50",
            "1234       | 1234.00",
            "1 234,56   | 1234.56",
            "CHF 1'234.50 | 1234.50",
            "1,234,567  | 1234567.00",
            "0,125      | 0.125",
            "1234.567   | 1234.567",
            ".5         | 0.50",
    })
    void parse_localeVariants(String raw, String expected) {
        ParsedPrice p = PriceParser.parse(raw);

        assertThat(p.isOk()).as(raw).isTrue();
        assertThat(p.amount()).isEqualTo(new BigDecimal(expected));
    }

    @Test
    void parse_thousandsWithoutSymbol_isAmbiguous() {
        assertThat(PriceParser.parse("1,234").failure()).isEqualTo(ParsedPrice.Failure.UNPARSEABLE);
        assertThat(PriceParser.parse("1.234").failure()).isEqualTo(ParsedPrice.Failure.UNPARSEABLE);
    }

    @Test
    void parse_garbage_isUnparseable() {
        assertThat(PriceParser.parse("POA").isOk()).isFalse();
        assertThat(PriceParser.parse("N/A").isOk()).isFalse();
        assertThat(PriceParser.parse("").isOk()).isFalse();
        assertThat(PriceParser.parse(null).isOk()).isFalse();
        assertThat(PriceParser.parse("1.2.3,4,5").isOk()).isFalse();
        assertThat(PriceParser.parse("12.").isOk()).isFalse();
    }

    @Test
    void parse_negative_isReportedAsNegative() {
        assertThat(PriceParser.parse("-5.00").failure()).isEqualTo(ParsedPrice.Failure.NEGATIVE);
        assertThat(PriceParser.parse("(12.00)").failure()).isEqualTo(ParsedPrice.Failure.NEGATIVE);
    }

    @Test
    void parse_symbolsAndCodes_yieldCurrencyHint() {
        assertThat(PriceParser.parse("$5").currencyHint()).isEqualTo("USD");
        assertThat(PriceParser.parse("£5").currencyHint()).isEqualTo("GBP");
        assertThat(PriceParser.parse("5 €").currencyHint()).isEqualTo("EUR");
        assertThat(PriceParser.parse("¥500").currencyHint()).isEqualTo("JPY");
        assertThat(PriceParser.parse("₹99").currencyHint()).isEqualTo("INR");
        assertThat(PriceParser.parse("12.00 aud").currencyHint()).isEqualTo("AUD");
        assertThat(PriceParser.parse("12.00").currencyHint()).isNull();
    }

    @Test
    void parseNumeric_plainDecimal_isNeverAmbiguous() {
        assertThat(PriceParser.parseNumeric("1.125").amount()).isEqualTo(new BigDecimal("1.125"));
        assertThat(PriceParser.parseNumeric("45.5").amount()).isEqualTo(new BigDecimal("45.50"));
        assertThat(PriceParser.parseNumeric("1E+3").amount()).isEqualByComparingTo("1000");
        assertThat(PriceParser.parseNumeric("-2").failure()).isEqualTo(ParsedPrice.Failure.NEGATIVE);
        assertThat(PriceParser.parseNumeric("abc").failure()).isEqualTo(ParsedPrice.Failure.UNPARSEABLE);
    }

    private static final Locale[] LOCALES = {
            Locale.US, Locale.GERMANY, Locale.FRANCE, new Locale("de", "CH") };

    static Stream<Arguments> plainFormats() {
        // three decimals behind a short lead are ambiguous without a symbol, so plain amounts carry two
        return combinations(List.of("0.50", "12.50", "999.99", "1234.56", "1234567.89", "0.125"));
    }

    static Stream<Arguments> currencyFormats() {
        return combinations(List.of("0.50", "12.50", "1.125", "1234.56", "1234567.891"));
    }

    private static Stream<Arguments> combinations(List<String> values) {
        List<Arguments> args = new ArrayList<>();
        for (String value : values) {
            for (Locale locale : LOCALES) {
                args.add(Arguments.of(value, locale));
            }
        }
        return args.stream();
    }

    @ParameterizedTest
    @MethodSource("plainFormats")
    void parse_formattedWithoutSymbol_roundTrips(String value, Locale locale) {
        BigDecimal expected = new BigDecimal(value);
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        format.setMinimumFractionDigits(expected.scale());
        format.setMaximumFractionDigits(expected.scale());
        String text = format.format(expected);

        ParsedPrice p = PriceParser.parse(text);

        assertThat(p.isOk()).as(text).isTrue();
        assertThat(p.amount()).as(text).isEqualByComparingTo(expected);
    }

    @ParameterizedTest
    @MethodSource("currencyFormats")
    void parse_formattedWithCurrency_roundTripsAmountAndCurrency(String value, Locale locale) {
        BigDecimal expected = new BigDecimal(value);
        NumberFormat format = NumberFormat.getCurrencyInstance(locale);
        format.setMinimumFractionDigits(expected.scale());
        format.setMaximumFractionDigits(expected.scale());
        String text = format.format(expected);

        ParsedPrice p = PriceParser.parse(text);

        assertThat(p.isOk()).as(text).isTrue();
        assertThat(p.amount()).as(text).isEqualByComparingTo(expected);
        assertThat(p.currencyHint()).as(text).isEqualTo(format.getCurrency().getCurrencyCode());
    }

    @Test
    void parse_resultAlwaysHasAtLeastTwoDecimals() {
        assertThat(PriceParser.parse("7").amount().scale()).isEqualTo(2);
        assertThat(PriceParser.parse("7.1").amount().scale()).isEqualTo(2);
        assertThat(PriceParser.parse("7.1234").amount().scale()).isEqualTo(4);
    }
}
