package com.cardvault.features.cards.domain;

import com.cardvault.common.domain.BaseEntity;
import com.cardvault.common.persistence.EpochMillisConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the card aggregate.
 * Owns its phones, emails and addresses; tag links are kept in card_tags and
 * removed by the store's foreign-key cascade.
 */
@Entity
@Table(name = "cards")
public class Card extends BaseEntity<Long> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private String name;
    
    @Column(nullable = false)
    private String title = "";
    
    @Column(nullable = false)
    private String company = "";
    
    @Column(nullable = false)
    private String website = "";
    
    @Column(nullable = false)
    private String notes = "";
    
    @Column(name = "photo_path", nullable = false)
    private String photoPath = "";
    
    @Convert(converter = EpochMillisConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Convert(converter = EpochMillisConverter.class)
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @OneToMany(mappedBy = "card", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<CardPhone> phones = new ArrayList<>();
    
    @OneToMany(mappedBy = "card", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<CardEmail> emails = new ArrayList<>();
    
    @OneToMany(mappedBy = "card", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<CardAddress> addresses = new ArrayList<>();
    
    protected Card() {
        // JPA constructor
    }
    
    public Card(String name, String title, String company, String website, String notes) {
        applyDetails(name, title, company, website, notes);
        this.createdAt = now();
        this.updatedAt = this.createdAt;
    }
    
    /**
     * Replace every scalar field except the photo reference.
     */
    public void updateDetails(String name, String title, String company, String website, String notes) {
        applyDetails(name, title, company, website, notes);
        touch();
    }
    
    private void applyDetails(String name, String title, String company, String website, String notes) {
        String trimmedName = name == null ? "" : name.trim();
        if (trimmedName.isEmpty()) {
            throw new IllegalArgumentException("Name is required");
        }
        this.name = trimmedName;
        this.title = trimToEmpty(title);
        this.company = trimToEmpty(company);
        this.website = trimToEmpty(website);
        this.notes = trimToEmpty(notes);
    }
    
    public void addPhone(String label, String number) {
        phones.add(new CardPhone(this, label, number));
    }
    
    public void addEmail(String label, String address) {
        emails.add(new CardEmail(this, label, address));
    }
    
    public void addAddress(String label, String street, String city, String country, String postal) {
        addresses.add(new CardAddress(this, label, street, city, country, postal));
    }
    
    /**
     * Drop every owned child row. Orphan removal deletes them on flush;
     * rows added afterwards receive new ids.
     */
    public void clearChildren() {
        phones.clear();
        emails.clear();
        addresses.clear();
    }
    
    /**
     * Point the card at a stored photo.
     * @return the previous photo path, empty if there was none
     */
    public String attachPhoto(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Photo path cannot be blank");
        }
        String previous = this.photoPath;
        this.photoPath = path;
        touch();
        return previous;
    }
    
    /**
     * Clear the photo reference.
     * @return the previous photo path, empty if there was none
     */
    public String detachPhoto() {
        String previous = this.photoPath;
        this.photoPath = "";
        touch();
        return previous;
    }
    
    public boolean hasPhoto() {
        return !photoPath.isEmpty();
    }
    
    private void touch() {
        this.updatedAt = now();
    }
    
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
    
    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    // Getters
    public String getName() { return name; }
    public String getTitle() { return title; }
    public String getCompany() { return company; }
    public String getWebsite() { return website; }
    public String getNotes() { return notes; }
    public String getPhotoPath() { return photoPath; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public List<CardPhone> getPhones() { return Collections.unmodifiableList(phones); }
    public List<CardEmail> getEmails() { return Collections.unmodifiableList(emails); }
    public List<CardAddress> getAddresses() { return Collections.unmodifiableList(addresses); }
}
