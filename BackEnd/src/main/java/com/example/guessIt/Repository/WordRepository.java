package com.example.guessIt.Repository;

import com.example.guessIt.DTO.WordEntry;
import com.example.guessIt.Entity.Category;
import com.example.guessIt.Entity.Word;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface WordRepository extends JpaRepository<Word, Long> {

    @Query("""
        select new com.example.guessIt.DTO.WordEntry(w.word, c.name)
        from Word w join w.category c
    """)
    List<WordEntry> findAllEntries();

    Optional<Word> findByWordIgnoreCase(String word);

    boolean existsByWordIgnoreCase(String word);

    long countByCategory(Category category);
}
