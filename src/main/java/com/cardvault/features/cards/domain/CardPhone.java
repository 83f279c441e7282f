package com.cardvault.features.cards.domain;

import com.cardvault.common.domain.BaseEntity;
import jakarta.persistence.*;

@Entity
@Table(name = "card_phones")
public class CardPhone extends BaseEntity<Long> {
    
    static final String DEFAULT_LABEL = "mobile";
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "card_id", nullable = false)
    private Card card;
    
    @Column(nullable = false)
    private String label;
    
    @Column(nullable = false)
    private String number;
    
    protected CardPhone() {
        // JPA constructor
    }
    
    CardPhone(Card card, String label, String number) {
        if (number == null) {
            throw new IllegalArgumentException("Phone number is required");
        }
        this.card = card;
        this.label = label == null ? DEFAULT_LABEL : label;
        this.number = number;
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    public Card getCard() { return card; }
    public String getLabel() { return label; }
    public String getNumber() { return number; }
}
