package org.dicepool.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

@Entity // Indique que cette classe est une entité JPA (table dans la base de données)
@Table(name = "utilisateur")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Utilisateur {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false) // l'email sert d'identité de parieur
    private String email;

    @Column(nullable = false)
    private String pseudo;

    @Column(nullable = false) // mot de passe haché (jamais en clair)
    private String motDePasseHash;

    @Builder.Default
    private LocalDateTime dateCreation = LocalDateTime.now();

    @Builder.Default
    private boolean active = true;

    // USER par défaut ; les droits du moteur passent par l'autorité, pas par ce rôle
    @Builder.Default
    @Column(nullable = false)
    private String role = "USER";
}
