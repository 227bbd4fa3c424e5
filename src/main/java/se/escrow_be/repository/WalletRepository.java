package se.escrow_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import se.escrow_be.pojo.Wallet;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, String> {
}
