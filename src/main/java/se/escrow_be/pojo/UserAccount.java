package se.escrow_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.escrow_be.pojo.enums.UserRole;

/**
 * A registered party. The public key is the RSA SPKI PEM every signature of this user
 * is verified against.
 */
@Entity
@Table(name = "user_accounts")
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAccount extends BaseEntity {

    @Id
    @Column(length = 36)
    private String userId;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private UserRole role;

    @Column(nullable = false, columnDefinition = "text")
    @ToString.Exclude
    private String publicKey;
}
