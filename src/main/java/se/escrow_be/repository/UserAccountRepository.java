package se.escrow_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import se.escrow_be.pojo.UserAccount;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    boolean existsByUsername(String username);
}
