package tech.andrefsramos.product_watcher.adapters.outbound.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

class PriceTextParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "$1,299.99      | 1299.99 | USD",
            "1.299,99 €     | 1299.99 | EUR",
            "1 299,99 kr    | 1299.99 | DKK",
            "£89.50         | 89.50   | GBP",
            "R$ 10,50       | 10.50   | BRL",
            "EUR 45         | 45      | EUR",
            "CHF 1'299.00   | 1299.00 | CHF",
            "Now only 89,99 | 89.99   | USD",
            "kr 1 299,-     | 1299    | DKK",
            "12 345,50 kr.  | 12345.50 | DKK"
    })
    void shouldNormalizeAmountAndCurrency(String text, String amount, String currency) {
        assertThat(PriceTextParser.parseAmount(text)).hasValueSatisfying(
                v -> assertThat(v).isEqualByComparingTo(new BigDecimal(amount)));
        assertThat(PriceTextParser.currencyOrDefault(text)).isEqualTo(currency);
    }

    @Test
    void shouldTreatSingleSeparatorFollowedByThreeDigitsAsThousands() {
        assertThat(PriceTextParser.normalizeSeparators("1,299")).isEqualTo("1299");
        assertThat(PriceTextParser.normalizeSeparators("1.299.000")).isEqualTo("1299000");
        assertThat(PriceTextParser.normalizeSeparators("9.5")).isEqualTo("9.5");
    }

    @Test
    void shouldRejectMissingOrZeroAmounts() {
        assertThat(PriceTextParser.parseAmount("Free")).isEmpty();
        assertThat(PriceTextParser.parseAmount("€ 0,00")).isEmpty();
        assertThat(PriceTextParser.parseAmount(null)).isEmpty();
    }

    @Test
    void shouldAcceptOnlyThreeLetterCurrencyCodes() {
        assertThat(PriceTextParser.normalizeCurrencyCode(" eur ")).isEqualTo("EUR");
        assertThat(PriceTextParser.normalizeCurrencyCode("€")).isNull();
        assertThat(PriceTextParser.normalizeCurrencyCode(null)).isNull();
    }

    @Test
    void shouldReadOnlyFirstNumberWhenPricesAreSeparatedBySpace() {
        assertThat(PriceTextParser.parseAmount("19.99 24.99")).hasValueSatisfying(
                v -> assertThat(v).isEqualByComparingTo("19.99"));
        assertThat(PriceTextParser.parseAmount("19 2499")).hasValueSatisfying(
                v -> assertThat(v).isEqualByComparingTo("19"));
        assertThat(PriceTextParser.parseAmount("Was 24,99 now 19,99")).hasValueSatisfying(
                v -> assertThat(v).isEqualByComparingTo("24.99"));
    }

    @Test
    void shouldNotTakeKrInsideAWordAsKrone() {
        assertThat(PriceTextParser.detectCurrency("Kraft Mac & Cheese 12.99")).isEmpty();
        assertThat(PriceTextParser.currencyOrDefault("Kraft Mac & Cheese 12.99")).isEqualTo("USD");
        assertThat(PriceTextParser.detectCurrency("Pris: 499 kr")).contains("DKK");
    }
}
