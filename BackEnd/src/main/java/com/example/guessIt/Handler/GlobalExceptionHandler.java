package com.example.guessIt.Handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /* =========================
       lookups that found nothing
    ========================= */
    public abstract static class NotFoundException extends RuntimeException {
        protected NotFoundException(String message) {
            super(message);
        }
    }

    public static class WordNotFoundException extends NotFoundException {
        public WordNotFoundException(String word) {
            super("Word not found: " + word);
        }
    }

    public static class UserNotFoundException extends NotFoundException {
        public UserNotFoundException(String username) {
            super("User not found: " + username);
        }
    }

    public static class MetaNotFoundException extends NotFoundException {
        public MetaNotFoundException(String name) {
            super("Meta not found: " + name);
        }
    }

    public static class CategoryNotFoundException extends NotFoundException {
        public CategoryNotFoundException(String category) {
            super("Category not found: " + category);
        }
    }

    public static class RedeemNotFoundException extends NotFoundException {
        public RedeemNotFoundException(String name) {
            super("Redeem not found: " + name);
        }
    }

    /* =========================
       writes that clash with stored data
    ========================= */
    public abstract static class ConflictException extends RuntimeException {
        protected ConflictException(String message) {
            super(message);
        }
    }

    public static class WordExistsException extends ConflictException {
        public WordExistsException(String word) {
            super("Word already exists: " + word);
        }
    }

    public static class UserExistsException extends ConflictException {
        public UserExistsException(String username) {
            super("User already exists: " + username);
        }
    }

    public static class CategoryExistsException extends ConflictException {
        public CategoryExistsException(String category) {
            super("Category already exists: " + category);
        }
    }

    public static class CategoryNotEmptyException extends ConflictException {
        public CategoryNotEmptyException(String category) {
            super("Category still has words: " + category);
        }
    }

    public static class RedeemExistsException extends ConflictException {
        public RedeemExistsException(String name) {
            super("Redeem already exists: " + name);
        }
    }

    public static class NotEnoughTokensException extends ConflictException {
        public NotEnoughTokensException(String redeem, int cost, int tokens) {
            super(redeem + " costs " + cost + " tokens, only " + tokens + " available");
        }
    }

    // 404
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<String> handleNotFound(NotFoundException e) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(e.getMessage());
    }

    // 409
    @ExceptionHandler({ConflictException.class, IllegalStateException.class})
    public ResponseEntity<String> handleConflict(RuntimeException e) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(e.getMessage());
    }

    // 400
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<String> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(message);
    }

    // 500
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleException(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body("Internal server error");
    }
}
