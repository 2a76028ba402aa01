package com.example.guessIt.Repository;

import com.example.guessIt.DTO.Highscore;
import com.example.guessIt.Entity.UserAccount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByUsernameIgnoreCase(String username);

    boolean existsByUsernameIgnoreCase(String username);

    /* =========================
       highscores
    ========================= */

    @Query("""
        select distinct u.score
        from UserAccount u
        where u.score > 0
        order by u.score desc
    """)
    List<Integer> findTopScores(Pageable pageable);

    @Query("""
        select new com.example.guessIt.DTO.Highscore(u.username, u.score)
        from UserAccount u
        where u.score in :scores
        order by u.score desc, u.username asc
    """)
    List<Highscore> findByScores(@Param("scores") Collection<Integer> scores, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserAccount u set u.score = 0")
    int resetScores();
}
