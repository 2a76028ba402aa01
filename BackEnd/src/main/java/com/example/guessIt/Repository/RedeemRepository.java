package com.example.guessIt.Repository;

import com.example.guessIt.Entity.Redeem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RedeemRepository extends JpaRepository<Redeem, Long> {
    Optional<Redeem> findByNameIgnoreCase(String name);
    boolean existsByNameIgnoreCase(String name);
    List<Redeem> findAllByOrderByNameAsc();
}
