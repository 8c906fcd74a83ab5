package tech.andrefsramos.product_watcher.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Setter
@Getter
@ToString
@Entity @Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_watcher", columnList = "watcher_id")
})
public class AlertEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "watcher_id", nullable = false, length = 36)
    private String watcherId;

    @Column(nullable = false, length = 32)
    private String type;

    @Column(name = "product_name", length = 500) private String productName;
    @Column(name = "product_url", length = 2000) private String productUrl;
    @Column(name = "previous_value", length = 200) private String previousValue;
    @Column(name = "current_value", length = 200)  private String currentValue;

    @Column(nullable = false, length = 500)
    private String message;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
