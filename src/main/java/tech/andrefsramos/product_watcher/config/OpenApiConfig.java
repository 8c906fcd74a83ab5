package tech.andrefsramos.product_watcher.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Product Watcher - API administrativa do worker",
                version = "v1",
                description = """
                                ---

                                ## 🎯 Visão Geral

                                O **Product Watcher** verifica periodicamente páginas de produtos cadastradas como
                                *watchers*, extrai preço, estoque e tamanhos disponíveis e gera alertas quando as
                                regras de cada watcher são atendidas.

                                ---

                                ## ⚙️ Como funciona

                                - A cada ciclo o agendador busca watchers ativos devidos e os enfileira por prioridade.
                                - Os workers respeitam um intervalo mínimo por domínio, com backoff exponencial em falhas.
                                - As requisições são condicionais (ETag / Last-Modified): páginas sem mudança não são reprocessadas.
                                - Após 5 falhas consecutivas o watcher vai para **ERROR** e sai do agendamento até ser reativado.

                                ---

                                ### 📌 Tratamento de erros resumido
                                | **Código** | **Significado** |
                                |--------|-------------|
                                | **200** | Sucesso |
                                | **204** | Operação concluída sem corpo |
                                | **400** | Parâmetros inválidos |
                                | **404** | Watcher não encontrado |
                                | **409** | Watcher não está ACTIVE |
                                | **503** | Verificação não pôde ser executada agora |

                                ---

                                ## 🧩Endpoints

                                """
        )
)
public class OpenApiConfig {
}
