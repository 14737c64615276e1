package com.deepansh.kitchen.inventory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fills an empty pantry with a starter set of staples at start-up.
 * Existing pantries are never touched.
 */
@Component
@Slf4j
public class PantrySeeder implements ApplicationRunner {

    static final List<PantryItemDocument> DEFAULT_PANTRY = List.of(
            item("rice", 500, "g"),
            item("chicken", 1, "kg"),
            item("onion", 5, "pieces"),
            item("garlic", 1, "head"),
            item("tomato", 3, "pieces"),
            item("salt", 200, "g")
    );

    private final PantryRepository pantryRepository;

    @Value("${kitchen.pantry.seed-on-startup:true}")
    private boolean seedOnStartup = true;

    public PantrySeeder(PantryRepository pantryRepository) {
        this.pantryRepository = pantryRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!seedOnStartup) {
            log.debug("Pantry seeding disabled");
            return;
        }
        seedIfEmpty();
    }

    public int seedIfEmpty() {
        if (pantryRepository.count() > 0) {
            log.debug("Pantry already has items, skipping seed");
            return 0;
        }
        List<PantryItemDocument> seeded = DEFAULT_PANTRY.stream()
                .map(d -> item(d.getName(), d.getQuantity(), d.getUnit()))
                .toList();
        pantryRepository.saveAll(seeded);
        log.info("Seeded pantry with {} default items", seeded.size());
        return seeded.size();
    }

    private static PantryItemDocument item(String name, double quantity, String unit) {
        return PantryItemDocument.builder().name(name).quantity(quantity).unit(unit).build();
    }
}
