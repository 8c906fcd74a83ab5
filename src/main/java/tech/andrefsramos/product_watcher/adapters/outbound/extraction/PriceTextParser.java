package tech.andrefsramos.product_watcher.adapters.outbound.extraction;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Normaliza textos de preço encontrados em páginas ("$1,299.99", "1.299,99 €", "kr 1 299,-")
 * para um decimal simples + código de moeda de 3 letras.

 * Separadores

 * - Com '.' e ',' presentes, o último a aparecer é o separador decimal.
 * - Com um único tipo repetido ("1.299.000"), é separador de milhar.
 * - Com uma única ocorrência seguida de exatamente 3 dígitos ("1,299"), é separador de milhar;
 *   caso contrário é decimal ("89,99", "9.5").
 * - Espaços, espaços não separáveis e apóstrofos ("1'299.00") só valem como milhar quando seguidos
 *   de exatamente 3 dígitos; "19.99 24.99" são dois números e só o primeiro é lido.
 */
public final class PriceTextParser {

    public static final String DEFAULT_CURRENCY = "USD";

    private static final Pattern NUMBER = Pattern.compile(
            "\\d{1,3}(?:[\\s\\u00A0\\u202F']\\d{3}(?!\\d))+(?:[.,]\\d+)*|\\d[\\d.,]*\\d|\\d");
    // "kr" isolado: não casa com "Kraft" nem "Krone"
    private static final Pattern KRONE = Pattern.compile("(?<!\\p{L})kr(?!\\p{L})");
    private static final Pattern ISO_CODE =
            Pattern.compile("\\b(USD|EUR|GBP|DKK|SEK|NOK|CHF|JPY|CAD|AUD|BRL|PLN)\\b");

    private PriceTextParser() {}

    public static Optional<BigDecimal> parseAmount(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Matcher m = NUMBER.matcher(text);
        if (!m.find()) return Optional.empty();

        String raw = m.group().replaceAll("[\\s\\u00A0\\u202F']", "");
        String normalized = normalizeSeparators(raw);
        if (normalized.isEmpty()) return Optional.empty();

        try {
            BigDecimal value = new BigDecimal(normalized);
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Código ISO explícito, depois símbolo; {@link Optional#empty()} se nada for reconhecido. */
    public static Optional<String> detectCurrency(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Matcher iso = ISO_CODE.matcher(text.toUpperCase(Locale.ROOT));
        if (iso.find()) return Optional.of(iso.group(1));

        if (text.contains("€")) return Optional.of("EUR");
        if (text.contains("£")) return Optional.of("GBP");
        if (text.contains("¥")) return Optional.of("JPY");
        if (text.contains("R$")) return Optional.of("BRL");
        if (text.contains("$")) return Optional.of("USD");
        if (KRONE.matcher(text.toLowerCase(Locale.ROOT)).find()) return Optional.of("DKK");
        return Optional.empty();
    }

    public static String currencyOrDefault(String text) {
        return detectCurrency(text).orElse(DEFAULT_CURRENCY);
    }

    /** Código de moeda já informado por dados estruturados: aceita apenas 3 letras. */
    public static String normalizeCurrencyCode(String code) {
        if (code == null) return null;
        String c = code.trim().toUpperCase(Locale.ROOT);
        return c.matches("[A-Z]{3}") ? c : null;
    }

    static String normalizeSeparators(String raw) {
        int lastDot = raw.lastIndexOf('.');
        int lastComma = raw.lastIndexOf(',');

        if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char thousands = decimal == '.' ? ',' : '.';
            return raw.replace(String.valueOf(thousands), "").replace(decimal, '.');
        }

        char sep = lastDot >= 0 ? '.' : (lastComma >= 0 ? ',' : 0);
        if (sep == 0) return raw;

        int occurrences = raw.length() - raw.replace(String.valueOf(sep), "").length();
        int digitsAfter = raw.length() - raw.lastIndexOf(sep) - 1;

        if (occurrences > 1 || digitsAfter == 3) {
            return raw.replace(String.valueOf(sep), "");
        }
        return raw.replace(sep, '.');
    }
}
