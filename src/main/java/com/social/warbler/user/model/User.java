// src/main/java/com/social/warbler/user/model/User.java
package com.social.warbler.user.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "users")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    public static final String DEFAULT_IMAGE_URL = "/static/images/default-pic.png";
    public static final String DEFAULT_HEADER_IMAGE_URL = "/static/images/warbler-hero.jpg";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false, unique = true)
    private String username;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "header_image_url", length = 1024)
    private String headerImageUrl;

    @Column(length = 2000)
    private String bio;

    @Column(length = 255)
    private String location;

    /** BCrypt hash, never the plaintext. */
    @JsonIgnore
    @Column(nullable = false)
    private String password;

    @PrePersist
    void prePersist() {
        if (imageUrl == null || imageUrl.isBlank()) imageUrl = DEFAULT_IMAGE_URL;
        if (headerImageUrl == null || headerImageUrl.isBlank()) headerImageUrl = DEFAULT_HEADER_IMAGE_URL;
    }

    @Override
    public String toString() {
        return "<User #" + id + ": " + username + ", " + email + ">";
    }
}
