package com.example.guessIt.Service;

import com.example.guessIt.Config.RoundProperties;
import com.example.guessIt.DTO.Highscore;
import com.example.guessIt.DTO.RedeemDTO;
import com.example.guessIt.DTO.WordEntry;
import com.example.guessIt.Domain.GameStore;
import com.example.guessIt.Domain.RoundMetaKeys;
import com.example.guessIt.Entity.Category;
import com.example.guessIt.Entity.Meta;
import com.example.guessIt.Entity.Redeem;
import com.example.guessIt.Entity.UserAccount;
import com.example.guessIt.Entity.Word;
import com.example.guessIt.Handler.GlobalExceptionHandler.CategoryExistsException;
import com.example.guessIt.Handler.GlobalExceptionHandler.CategoryNotEmptyException;
import com.example.guessIt.Handler.GlobalExceptionHandler.CategoryNotFoundException;
import com.example.guessIt.Handler.GlobalExceptionHandler.RedeemExistsException;
import com.example.guessIt.Handler.GlobalExceptionHandler.RedeemNotFoundException;
import com.example.guessIt.Handler.GlobalExceptionHandler.UserExistsException;
import com.example.guessIt.Handler.GlobalExceptionHandler.UserNotFoundException;
import com.example.guessIt.Handler.GlobalExceptionHandler.WordExistsException;
import com.example.guessIt.Handler.GlobalExceptionHandler.WordNotFoundException;
import com.example.guessIt.Repository.CategoryRepository;
import com.example.guessIt.Repository.MetaRepository;
import com.example.guessIt.Repository.RedeemRepository;
import com.example.guessIt.Repository.UserAccountRepository;
import com.example.guessIt.Repository.WordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link GameStore} on top of the Spring Data repositories. Each call runs in its own
 * transaction.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class JpaGameStore implements GameStore {

    private static final int SCORE_TIERS = 3;

    private final WordRepository wordRepository;
    private final CategoryRepository categoryRepository;
    private final UserAccountRepository userAccountRepository;
    private final RedeemRepository redeemRepository;
    private final MetaRepository metaRepository;
    private final RoundProperties properties;

    /* ============================================================
       word list
    ============================================================ */

    @Override
    @Transactional(readOnly = true)
    public List<WordEntry> getWords() {
        return wordRepository.findAllEntries();
    }

    @Override
    public void removeWord(String word) {
        Word entry = wordRepository.findByWordIgnoreCase(word)
                .orElseThrow(() -> new WordNotFoundException(word));
        Category category = entry.getCategory();

        wordRepository.delete(entry);

        if (wordRepository.countByCategory(category) == 0) {
            log.info("Category {} has no words left, removing it", category.getName());
            categoryRepository.delete(category);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public int remainingWordCount() {
        return (int) wordRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public String getCategory(String word) {
        return wordRepository.findByWordIgnoreCase(word)
                .map(w -> w.getCategory().getName())
                .orElseThrow(() -> new WordNotFoundException(word));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> getCategories() {
        return categoryRepository.findAllByOrderByNameAsc().stream()
                .map(Category::getName)
                .toList();
    }

    @Override
    public void addCategory(String category) {
        if (categoryRepository.existsByNameIgnoreCase(category)) {
            throw new CategoryExistsException(category);
        }
        categoryRepository.save(Category.builder().name(category).build());
    }

    @Override
    public void removeCategory(String category) {
        Category entity = categoryRepository.findByNameIgnoreCase(category)
                .orElseThrow(() -> new CategoryNotFoundException(category));

        if (wordRepository.countByCategory(entity) > 0) {
            throw new CategoryNotEmptyException(category);
        }
        categoryRepository.delete(entity);
    }

    @Override
    public void addWord(String word, String category) {
        Category entity = categoryRepository.findByNameIgnoreCase(category)
                .orElseThrow(() -> new CategoryNotFoundException(category));

        if (wordRepository.existsByWordIgnoreCase(word)) {
            throw new WordExistsException(word);
        }
        wordRepository.save(new Word(word, entity));
    }

    @Override
    public void addWords(List<String> words, String category) {
        log.info("Adding {} words to category {}", words.size(), category);

        // check the whole batch first so a duplicate leaves the list untouched
        Set<String> seen = new HashSet<>();
        for (String word : words) {
            if (!seen.add(word.toLowerCase(Locale.ROOT)) || wordRepository.existsByWordIgnoreCase(word)) {
                throw new WordExistsException(word);
            }
        }

        Category entity = categoryRepository.findByNameIgnoreCase(category)
                .orElseGet(() -> {
                    log.info("Category {} does not exist, creating", category);
                    return categoryRepository.save(Category.builder().name(category).build());
                });

        wordRepository.saveAll(words.stream().map(w -> new Word(w, entity)).toList());
    }

    @Override
    public void setWordlist(Map<String, List<String>> wordlist) {
        log.info("Replacing the word list with {} categories", wordlist.size());

        Set<String> seen = new HashSet<>();
        wordlist.values().forEach(words -> words.forEach(word -> {
            if (!seen.add(word.toLowerCase(Locale.ROOT))) {
                throw new WordExistsException(word);
            }
        }));

        wordRepository.deleteAll();
        categoryRepository.deleteAll();
        // deletes must reach the database before names are reused
        categoryRepository.flush();

        wordlist.forEach((category, words) -> {
            Category entity = categoryRepository.save(Category.builder().name(category).build());
            wordRepository.saveAll(words.stream().map(w -> new Word(w, entity)).toList());
        });
    }

    /* ============================================================
       users
    ============================================================ */

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findUser(String username) {
        return userAccountRepository.findByUsernameIgnoreCase(username);
    }

    @Override
    public void addUser(String username, int score, int tokens) {
        if (userAccountRepository.existsByUsernameIgnoreCase(username)) {
            throw new UserExistsException(username);
        }
        log.info("Adding user {}", username);
        userAccountRepository.save(UserAccount.builder()
                .username(username)
                .score(score)
                .tokens(tokens)
                .build());
    }

    @Override
    public void addScore(String username, int amount) {
        requireUser(username).addScore(amount);
    }

    @Override
    @Transactional(readOnly = true)
    public int getScore(String username) {
        return userAccountRepository.findByUsernameIgnoreCase(username)
                .map(UserAccount::getScore)
                .orElse(0);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Highscore> getHighscores() {
        List<Integer> topScores = userAccountRepository.findTopScores(PageRequest.of(0, SCORE_TIERS));
        if (topScores.isEmpty()) {
            return List.of();
        }
        return userAccountRepository.findByScores(topScores, PageRequest.of(0, properties.getHighscoreLimit()));
    }

    @Override
    public void resetScores() {
        log.info("Resetting scores for all users");
        userAccountRepository.resetScores();
    }

    @Override
    @Transactional(readOnly = true)
    public int getTokens(String username) {
        return userAccountRepository.findByUsernameIgnoreCase(username)
                .map(UserAccount::getTokens)
                .orElse(0);
    }

    @Override
    public void setTokens(String username, int amount) {
        requireUser(username).setTokens(amount);
    }

    @Override
    public void addTokens(String username, int amount) {
        log.info("Adding {} tokens to {}", amount, username);
        requireUser(username).addTokens(amount);
    }

    @Override
    public void removeTokens(String username, int amount) {
        log.info("Removing {} tokens from {}", amount, username);
        requireUser(username).removeTokens(amount);
    }

    @Override
    public void migrateUser(String oldUsername, String newUsername) {
        log.info("Migrating user {} to {}", oldUsername, newUsername);

        UserAccount oldUser = requireUser(oldUsername);
        UserAccount newUser = requireUser(newUsername);

        newUser.addScore(oldUser.getScore());
        newUser.addTokens(oldUser.getTokens());
        userAccountRepository.delete(oldUser);
    }

    private UserAccount requireUser(String username) {
        return userAccountRepository.findByUsernameIgnoreCase(username)
                .orElseThrow(() -> new UserNotFoundException(username));
    }

    /* ============================================================
       redeems
    ============================================================ */

    @Override
    @Transactional(readOnly = true)
    public List<RedeemDTO> getRedeems() {
        return redeemRepository.findAllByOrderByNameAsc().stream()
                .map(r -> RedeemDTO.builder().name(r.getName()).cost(r.getCost()).build())
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public int getRedeemCost(String name) {
        return requireRedeem(name).getCost();
    }

    @Override
    public void addRedeem(String name, int cost) {
        if (redeemRepository.existsByNameIgnoreCase(name)) {
            throw new RedeemExistsException(name);
        }
        redeemRepository.save(Redeem.builder().name(name).cost(cost).build());
    }

    @Override
    public void modifyRedeem(String name, String newName, int newCost) {
        Redeem redeem = requireRedeem(name);

        if (!name.equalsIgnoreCase(newName) && redeemRepository.existsByNameIgnoreCase(newName)) {
            throw new RedeemExistsException(newName);
        }
        redeem.setName(newName);
        redeem.setCost(newCost);
    }

    @Override
    public void removeRedeem(String name) {
        redeemRepository.delete(requireRedeem(name));
    }

    private Redeem requireRedeem(String name) {
        return redeemRepository.findByNameIgnoreCase(name)
                .orElseThrow(() -> new RedeemNotFoundException(name));
    }

    /* ============================================================
       meta
    ============================================================ */

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findMeta(String name) {
        return metaRepository.findByNameIgnoreCase(name).map(Meta::getData);
    }

    @Override
    public void setMeta(String name, String data) {
        Meta meta = metaRepository.findByNameIgnoreCase(name)
                .orElseGet(() -> Meta.builder().name(name).build());
        meta.setData(data);
        metaRepository.save(meta);
    }

    @Override
    public void resetRound() {
        log.info("Resetting the round status");
        setMeta(RoundMetaKeys.UPDATE_ROUND, "true");
        setMeta(RoundMetaKeys.ROUND_END, "false");
    }
}
