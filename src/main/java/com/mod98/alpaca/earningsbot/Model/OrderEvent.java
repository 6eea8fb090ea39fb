package com.mod98.alpaca.earningsbot.Model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "order_events")
@Getter @Setter
public class OrderEvent {

    public enum EventType {
        REJECTED,
        SUBMITTED,
        FILLED,
        PARTIALLY_FILLED,
        NOT_FILLED,
        ERROR
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 20, nullable = false)
    private EventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private TradeAction action;

    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", length = 10)
    private OrderType orderType;

    @Column(name = "limit_price", precision = 12, scale = 4)
    private BigDecimal limitPrice;

    @Column(name = "reference_price", precision = 12, scale = 4)
    private BigDecimal referencePrice;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private OrderStatus status;

    @Column(name = "filled_quantity")
    private Integer filledQuantity;

    @Column(name = "avg_fill_price", precision = 12, scale = 4)
    private BigDecimal avgFillPrice;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(length = 60)
    private String reason;

    @Column(length = 255)
    private String message;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
