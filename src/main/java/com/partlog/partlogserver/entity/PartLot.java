package com.partlog.partlogserver.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Партия детали на складе (количество + место хранения).
 */
@Entity
@Table(name = "part_lots")
@Getter
@Setter
@NoArgsConstructor
public class PartLot extends AbstractDBElement implements HasInstock {

    private String description;
    private BigDecimal amount = BigDecimal.ZERO;
    private LocalDate expirationDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "part_id")
    private Part part;

    public PartLot(Part part, BigDecimal amount) {
        this.part = part;
        this.amount = amount;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.PART_LOT;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("description", description);
        fields.put("amount", amount);
        fields.put("expirationDate", expirationDate);
        fields.put("part", part);
        return fields;
    }
}
