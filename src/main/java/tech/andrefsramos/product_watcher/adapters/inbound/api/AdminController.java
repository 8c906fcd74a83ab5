package tech.andrefsramos.product_watcher.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.product_watcher.adapters.inbound.api.dto.DispatchResponse;
import tech.andrefsramos.product_watcher.adapters.inbound.api.dto.ThrottleStatusResponse;
import tech.andrefsramos.product_watcher.core.application.CheckWatcherUseCase;
import tech.andrefsramos.product_watcher.core.application.DispatchDueWatchersUseCase;
import tech.andrefsramos.product_watcher.core.application.ReactivateWatcherUseCase;
import tech.andrefsramos.product_watcher.core.application.ThrottleCoordinator;
import tech.andrefsramos.product_watcher.core.domain.CheckOutcome;
import tech.andrefsramos.product_watcher.core.domain.CheckStatus;
import tech.andrefsramos.product_watcher.core.domain.DomainNames;
import tech.andrefsramos.product_watcher.core.ports.JobQueue;

/**
 * AdminController

 * Operações administrativas do worker: disparo manual do agendador, verificação imediata de um
 * watcher, reset de watchers em ERROR e inspeção/limpeza do throttle por domínio.
 */
@RestController
@RequestMapping("/admin")
@Tag(
        name = "01",
        description = """
## ADMIN
---
Operações administrativas do worker de monitoramento de produtos.

### ⚙️ Funcionalidades disponíveis
- Executar uma passada do agendador imediatamente
- Verificar um watcher agora, fora do agendamento
- Reativar um watcher que entrou em ERROR
- Consultar ou limpar o estado de throttle de um domínio
"""
)
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final DispatchDueWatchersUseCase dispatch;
    private final CheckWatcherUseCase check;
    private final ReactivateWatcherUseCase reactivate;
    private final ThrottleCoordinator throttle;
    private final JobQueue jobQueue;

    public AdminController(
            DispatchDueWatchersUseCase dispatch,
            CheckWatcherUseCase check,
            ReactivateWatcherUseCase reactivate,
            ThrottleCoordinator throttle,
            JobQueue jobQueue
    ) {
        this.dispatch = dispatch;
        this.check = check;
        this.reactivate = reactivate;
        this.throttle = throttle;
        this.jobQueue = jobQueue;
    }

    @PostMapping("/dispatch")
    @Operation(
            summary = "Executa uma passada do agendador agora",
            description = """
                Consulta os watchers devidos e enfileira os que ainda não têm job pendente,
                exatamente como o ciclo automático faz.
            """,
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Passada executada; retorna a quantidade enfileirada",
                            content = @Content(
                                    mediaType = "application/json",
                                    examples = @ExampleObject(value = "{\"queued\": 3}")
                            )
                    )
            }
    )
    public ResponseEntity<DispatchResponse> dispatchNow() {
        log.info("AdminController: passada manual do agendador solicitada");
        int queued = dispatch.dispatchDue();
        return ResponseEntity.ok(new DispatchResponse(queued));
    }

    @PostMapping("/watchers/{id}/check")
    @Operation(
            summary = "Verifica um watcher imediatamente",
            description = """
                Executa a verificação completa (throttle, fetch, parse, regras) de forma síncrona
                e retorna o resultado. Respeita o throttle do domínio, então pode demorar.

                ⚠️ Regras:
                    - Watcher inexistente: 404
                    - Watcher fora de ACTIVE ou com verificação já pendente/em execução: 409
                    - Sem permissão de fetch ou interrompido: 503
            """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Verificação executada (sucesso ou falha registrada)"),
                    @ApiResponse(responseCode = "404", description = "Watcher não encontrado"),
                    @ApiResponse(responseCode = "409", description = "Watcher não está ACTIVE ou já tem verificação pendente"),
                    @ApiResponse(responseCode = "503", description = "Verificação não pôde ser executada agora")
            },
            parameters = @Parameter(name = "id", description = "Id do watcher", example = "w-123")
    )
    public ResponseEntity<CheckOutcome> checkNow(@PathVariable String id) {
        log.info("AdminController: verificação manual solicitada watcherId='{}'", id);
        if (!jobQueue.claim(id)) {
            log.info("AdminController: watcherId='{}' já tem verificação pendente ou em execução", id);
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(CheckOutcome.of(id, CheckStatus.SKIPPED, "check already pending"));
        }
        try {
            CheckOutcome outcome = check.check(id);
            return ResponseEntity.status(statusFor(outcome)).body(outcome);
        } finally {
            jobQueue.complete(id);
        }
    }

    @PostMapping("/watchers/{id}/reactivate")
    @Operation(
            summary = "Reativa um watcher",
            description = "Volta o watcher para ACTIVE e zera o contador de erros consecutivos.",
            responses = {
                    @ApiResponse(responseCode = "204", description = "Watcher reativado"),
                    @ApiResponse(responseCode = "404", description = "Watcher não encontrado")
            }
    )
    public ResponseEntity<Void> reactivate(@PathVariable String id) {
        log.info("AdminController: reativação solicitada watcherId='{}'", id);
        return reactivate.reactivate(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/throttle/{domain}")
    @Operation(
            summary = "Consulta o throttle de um domínio",
            description = """
                Retorna a contagem de erros consecutivos, o intervalo mínimo exigido entre requisições
                e quanto falta para a próxima requisição permitida.
            """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Estado atual do domínio"),
                    @ApiResponse(responseCode = "400", description = "Domínio vazio ou inválido")
            }
    )
    public ResponseEntity<ThrottleStatusResponse> throttleStatus(@PathVariable String domain) {
        String d = DomainNames.normalize(domain);
        if (d.isEmpty()) {
            log.warn("AdminController: parâmetro 'domain' inválido ou vazio");
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(new ThrottleStatusResponse(
                d,
                throttle.errorCount(d),
                throttle.currentDelay(d).toMillis(),
                throttle.canProceed(d).toMillis()
        ));
    }

    @DeleteMapping("/throttle/{domain}")
    @Operation(
            summary = "Limpa o throttle de um domínio",
            description = "Esquece o histórico do domínio; a próxima requisição é liberada imediatamente.",
            responses = {
                    @ApiResponse(responseCode = "204", description = "Estado removido"),
                    @ApiResponse(responseCode = "400", description = "Domínio vazio ou inválido")
            }
    )
    public ResponseEntity<Void> resetThrottle(@PathVariable String domain) {
        String d = DomainNames.normalize(domain);
        if (d.isEmpty()) {
            log.warn("AdminController: parâmetro 'domain' inválido ou vazio");
            return ResponseEntity.badRequest().build();
        }
        throttle.reset(d);
        log.info("AdminController: throttle removido domain='{}'", d);
        return ResponseEntity.noContent().build();
    }

    static HttpStatus statusFor(CheckOutcome outcome) {
        return switch (outcome.status()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_ACTIVE -> HttpStatus.CONFLICT;
            case SKIPPED, CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.OK;
        };
    }
}
