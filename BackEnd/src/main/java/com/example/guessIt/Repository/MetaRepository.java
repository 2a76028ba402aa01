package com.example.guessIt.Repository;

import com.example.guessIt.Entity.Meta;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MetaRepository extends JpaRepository<Meta, Long> {
    Optional<Meta> findByNameIgnoreCase(String name);
}
