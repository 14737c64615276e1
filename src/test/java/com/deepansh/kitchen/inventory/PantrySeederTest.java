package com.deepansh.kitchen.inventory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PantrySeederTest {

    @Mock PantryRepository pantryRepository;

    @InjectMocks
    PantrySeeder seeder;

    @Test
    void seedIfEmpty_emptyPantry_savesDefaultStaples() {
        when(pantryRepository.count()).thenReturn(0L);

        int seeded = seeder.seedIfEmpty();

        assertThat(seeded).isEqualTo(PantrySeeder.DEFAULT_PANTRY.size());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PantryItemDocument>> saved = ArgumentCaptor.forClass(List.class);
        verify(pantryRepository).saveAll(saved.capture());
        assertThat(saved.getValue()).extracting(PantryItemDocument::getName).contains("rice", "chicken", "salt");
    }

    @Test
    void seedIfEmpty_existingPantry_isLeftAlone() {
        when(pantryRepository.count()).thenReturn(3L);

        assertThat(seeder.seedIfEmpty()).isZero();
        verify(pantryRepository, never()).saveAll(anyList());
    }
}
