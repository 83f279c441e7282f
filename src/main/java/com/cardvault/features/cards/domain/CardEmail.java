package com.cardvault.features.cards.domain;

import com.cardvault.common.domain.BaseEntity;
import jakarta.persistence.*;

@Entity
@Table(name = "card_emails")
public class CardEmail extends BaseEntity<Long> {
    
    static final String DEFAULT_LABEL = "work";
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "card_id", nullable = false)
    private Card card;
    
    @Column(nullable = false)
    private String label;
    
    @Column(nullable = false)
    private String address;
    
    protected CardEmail() {
        // JPA constructor
    }
    
    CardEmail(Card card, String label, String address) {
        if (address == null) {
            throw new IllegalArgumentException("Email address is required");
        }
        this.card = card;
        this.label = label == null ? DEFAULT_LABEL : label;
        this.address = address;
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    public Card getCard() { return card; }
    public String getLabel() { return label; }
    public String getAddress() { return address; }
}
