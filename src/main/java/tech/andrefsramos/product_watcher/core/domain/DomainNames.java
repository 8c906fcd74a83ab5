package tech.andrefsramos.product_watcher.core.domain;

import java.net.URI;
import java.util.Locale;

public final class DomainNames {

    private DomainNames() {}

    /**
     * Extrai o domínio normalizado de uma URL: minúsculo, sem "www." e sem porta.
     * Retorna string vazia quando a URL não é válida.
     */
    public static String fromUrl(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            String host = URI.create(url.trim()).getHost();
            return normalize(host);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    public static String normalize(String host) {
        if (host == null) return "";
        String h = host.trim().toLowerCase(Locale.ROOT);
        if (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        if (h.startsWith("www.")) h = h.substring(4);
        return h;
    }
}
