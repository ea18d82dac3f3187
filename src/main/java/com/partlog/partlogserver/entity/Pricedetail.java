package com.partlog.partlogserver.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "pricedetails")
@Getter
@Setter
@NoArgsConstructor
public class Pricedetail extends AbstractDBElement {

    private BigDecimal price = BigDecimal.ZERO;
    private Integer minDiscountQuantity = 1;
    private String currency;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "orderdetail_id")
    private Orderdetail orderdetail;

    @Override
    public EntityKind getKind() {
        return EntityKind.PRICEDETAIL;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("price", price);
        fields.put("minDiscountQuantity", minDiscountQuantity);
        fields.put("currency", currency);
        fields.put("orderdetail", orderdetail);
        return fields;
    }
}
