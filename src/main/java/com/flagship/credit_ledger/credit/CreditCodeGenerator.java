package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.exception.CodeGenerationExhaustedException;
import com.flagship.credit_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Generates human-readable credit codes of the form {@code SC-XXXXXXXX-TTC}.
 *
 * <ul>
 *   <li>XXXXXXXX: 8 random characters</li>
 *   <li>TT: current epoch minute modulo 1024, in base 32</li>
 *   <li>C: check character over the random and time parts</li>
 * </ul>
 *
 * The alphabet leaves out 0, O, 1 and I so codes survive being read aloud or retyped.
 * Uniqueness is checked against the store before a code is handed out; the unique index on
 * credits.code catches the remaining race between two generators.
 */
@Component
@Slf4j
public class CreditCodeGenerator {

    public static final String PREFIX = "SC";
    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private static final int RANDOM_LENGTH = 8;
    private static final Pattern CODE_PATTERN =
        Pattern.compile("^SC-[" + ALPHABET + "]{8}-[" + ALPHABET + "]{3}$");

    private final LedgerStore ledgerStore;
    private final Clock clock;
    private final int maxAttempts;
    private final Random random;

    @Autowired
    public CreditCodeGenerator(LedgerStore ledgerStore, Clock clock, CreditLedgerProperties properties) {
        this(ledgerStore, clock, properties.getCode().getMaxAttempts(), new SecureRandom());
    }

    CreditCodeGenerator(LedgerStore ledgerStore, Clock clock, int maxAttempts, Random random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.ledgerStore = ledgerStore;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * Returns a well-formed code not used by any existing credit.
     *
     * @throws CodeGenerationExhaustedException if every attempt collided
     */
    public String generateCode() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = candidate();
            if (!ledgerStore.codeExists(candidate)) {
                return candidate;
            }
            log.warn("Credit code collision on attempt {}/{}: {}", attempt, maxAttempts, candidate);
        }
        throw new CodeGenerationExhaustedException(
            "Could not generate an unused credit code after " + maxAttempts + " attempts");
    }

    /**
     * Checks the shape and check character of a code without consulting the store.
     */
    public static boolean isWellFormed(String code) {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            return false;
        }
        String body = code.substring(3, 11) + code.substring(12, 14);
        return code.charAt(14) == checkCharacter(body);
    }

    private String candidate() {
        StringBuilder body = new StringBuilder(RANDOM_LENGTH + 2);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            body.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        long minute = (clock.millis() / 60_000L) % (ALPHABET.length() * ALPHABET.length());
        body.append(ALPHABET.charAt((int) (minute / ALPHABET.length())));
        body.append(ALPHABET.charAt((int) (minute % ALPHABET.length())));

        return PREFIX + "-" + body.substring(0, RANDOM_LENGTH) + "-"
            + body.substring(RANDOM_LENGTH) + checkCharacter(body.toString());
    }

    // Position-weighted sum, so swapped neighbours change the check character.
    static char checkCharacter(String body) {
        int sum = 0;
        for (int i = 0; i < body.length(); i++) {
            sum += (i + 1) * ALPHABET.indexOf(body.charAt(i));
        }
        return ALPHABET.charAt(sum % ALPHABET.length());
    }
}
