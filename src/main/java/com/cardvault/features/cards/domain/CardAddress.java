package com.cardvault.features.cards.domain;

import com.cardvault.common.domain.BaseEntity;
import jakarta.persistence.*;

/**
 * Postal address owned by a card. Every part is optional and defaults to empty.
 */
@Entity
@Table(name = "card_addresses")
public class CardAddress extends BaseEntity<Long> {
    
    static final String DEFAULT_LABEL = "office";
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "card_id", nullable = false)
    private Card card;
    
    @Column(nullable = false)
    private String label;
    
    @Column(nullable = false)
    private String street;
    
    @Column(nullable = false)
    private String city;
    
    @Column(nullable = false)
    private String country;
    
    @Column(nullable = false)
    private String postal;
    
    protected CardAddress() {
        // JPA constructor
    }
    
    CardAddress(Card card, String label, String street, String city, String country, String postal) {
        this.card = card;
        this.label = label == null ? DEFAULT_LABEL : label;
        this.street = street == null ? "" : street;
        this.city = city == null ? "" : city;
        this.country = country == null ? "" : country;
        this.postal = postal == null ? "" : postal;
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    public Card getCard() { return card; }
    public String getLabel() { return label; }
    public String getStreet() { return street; }
    public String getCity() { return city; }
    public String getCountry() { return country; }
    public String getPostal() { return postal; }
}
