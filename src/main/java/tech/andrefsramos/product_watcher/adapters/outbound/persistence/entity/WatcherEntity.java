package tech.andrefsramos.product_watcher.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import tech.andrefsramos.product_watcher.core.domain.WatcherStatus;

import java.time.Instant;

@Setter
@Getter
@ToString(exclude = {"rulesJson", "lastSnapshotJson"})
@Entity @Table(name = "watchers", indexes = {
        @Index(name = "idx_watchers_status_last_check", columnList = "status,last_check_at")
})
public class WatcherEntity {
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 2000)
    private String url;

    @Column(nullable = false, length = 255)
    private String domain;

    @Lob @Column(name = "rules_json")
    private String rulesJson;

    @Column(name = "interval_seconds", nullable = false)
    private int intervalSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WatcherStatus status;

    @Column(name = "last_check_at") private Instant lastCheckAt;
    @Column(name = "last_alert_at") private Instant lastAlertAt;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    @Lob @Column(name = "last_snapshot_json")
    private String lastSnapshotJson;
}
