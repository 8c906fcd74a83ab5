package tech.andrefsramos.product_watcher.core.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/*
 * Finalidade

 * Resultado normalizado de um parse de página de produto. Não possui identidade própria:
 * cada verificação gera um snapshot novo, comparado com o anterior e depois persistido
 * como "anterior" do watcher.

 * - price e inStock são anuláveis: null significa "desconhecido", nunca zero/false.
 * - sizes é um conjunto ordenado (ordem de aparição na página, sem duplicatas).
 */
public record ProductSnapshot(
        String url,
        String title,
        BigDecimal price,
        String currency,
        Boolean inStock,
        List<String> sizes,
        String image,
        boolean success,
        String error
) {

    public ProductSnapshot {
        sizes = (sizes == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(sizes)));
    }

    public static ProductSnapshot failure(String url, String error) {
        return new ProductSnapshot(url, null, null, null, null, List.of(), null, false, error);
    }

    public boolean hasPrice() {
        return price != null;
    }
}
