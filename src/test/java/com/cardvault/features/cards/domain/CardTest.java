package com.cardvault.features.cards.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardTest {
    
    @Test
    void shouldRequireNonBlankName() {
        assertThatThrownBy(() -> new Card(" ", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Name is required");
        assertThatThrownBy(() -> new Card(null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void shouldDefaultChildLabels() {
        Card card = new Card("Tan", null, null, null, null);
        card.addPhone(null, "+65 1");
        card.addEmail(null, "tan@example.com");
        card.addAddress(null, null, null, null, null);
        
        assertThat(card.getPhones().get(0).getLabel()).isEqualTo("mobile");
        assertThat(card.getEmails().get(0).getLabel()).isEqualTo("work");
        assertThat(card.getAddresses().get(0).getLabel()).isEqualTo("office");
        assertThat(card.getAddresses().get(0).getCountry()).isEmpty();
    }
    
    @Test
    void shouldRequirePhoneNumberAndEmailAddress() {
        Card card = new Card("Tan", null, null, null, null);
        
        assertThatThrownBy(() -> card.addPhone("mobile", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> card.addEmail("work", null)).isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void shouldSwapPhotoPaths() {
        Card card = new Card("Tan", null, null, null, null);
        
        assertThat(card.hasPhoto()).isFalse();
        assertThat(card.attachPhoto("uploads/a.png")).isEmpty();
        assertThat(card.attachPhoto("uploads/b.png")).isEqualTo("uploads/a.png");
        assertThat(card.detachPhoto()).isEqualTo("uploads/b.png");
        assertThat(card.getPhotoPath()).isEmpty();
    }
    
    @Test
    void shouldTreatUnsavedCardsAsDistinct() {
        Card first = new Card("Tan", null, null, null, null);
        Card second = new Card("Tan", null, null, null, null);
        
        assertThat(first).isEqualTo(first);
        assertThat(first).isNotEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }
}
