package com.deepansh.kitchen.inventory;

import com.deepansh.kitchen.model.PantryItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One ingredient in the user's pantry.
 * Names are stored lower-case so lookups are case-insensitive.
 */
@Document(collection = "pantry_items")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PantryItemDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String name;

    private double quantity;
    private String unit;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    public PantryItem toPantryItem() {
        return new PantryItem(name, quantity, unit);
    }
}
