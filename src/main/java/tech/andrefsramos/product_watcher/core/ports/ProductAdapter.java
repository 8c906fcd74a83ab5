package tech.andrefsramos.product_watcher.core.ports;

import tech.andrefsramos.product_watcher.core.domain.ProductSnapshot;

import java.util.List;

public interface ProductAdapter {

    /** Domínios atendidos: exatos ("shop.com") ou curinga ("*.shop.com"). */
    List<String> domains();

    /** Nunca lança exceção: conteúdo inválido gera snapshot com success=false. */
    ProductSnapshot parse(String content, String url);
}
