package com.apogee.auth.service;

import com.apogee.auth.config.SecurityProperties;
import com.apogee.auth.enums.ErrorKind;
import com.apogee.auth.exception.AuthenticationException;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.passay.CharacterRule;
import org.passay.DictionaryRule;
import org.passay.EnglishCharacterData;
import org.passay.LengthRule;
import org.passay.PasswordData;
import org.passay.PasswordValidator;
import org.passay.Rule;
import org.passay.RuleResult;
import org.passay.UsernameRule;
import org.passay.WhitespaceRule;
import org.passay.dictionary.ArrayWordList;
import org.passay.dictionary.WordListDictionary;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Password strength policy backed by passay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordPolicyService {

    // sorted, the dictionary is searched with a binary search
    private static final String[] COMMON_PASSWORDS = {
            "admin123!", "letmein1!", "p@ssw0rd", "password", "password1!", "password123", "qwerty123!", "welcome1!"
    };

    private final SecurityProperties securityProperties;

    /**
     * Validate password against configured policies.
     *
     * @param email optional; the local part may not appear in the password
     */
    public PasswordValidationResult validatePassword(String password, String email) {
        if (password == null) {
            return PasswordValidationResult.builder()
                    .valid(false)
                    .errors(List.of("Password is required"))
                    .message("Password is required")
                    .build();
        }

        SecurityProperties.Password.Policy policy = securityProperties.getPassword().getPolicy();
        List<Rule> rules = new ArrayList<>();
        rules.add(new LengthRule(policy.getMinLength(), policy.getMaxLength()));
        if (policy.getRequireUppercase()) {
            rules.add(new CharacterRule(EnglishCharacterData.UpperCase, 1));
        }
        if (policy.getRequireLowercase()) {
            rules.add(new CharacterRule(EnglishCharacterData.LowerCase, 1));
        }
        if (policy.getRequireDigit()) {
            rules.add(new CharacterRule(EnglishCharacterData.Digit, 1));
        }
        if (policy.getRequireSpecial()) {
            rules.add(new CharacterRule(EnglishCharacterData.Special, 1));
        }
        rules.add(new WhitespaceRule());

        WordListDictionary dictionary = new WordListDictionary(new ArrayWordList(COMMON_PASSWORDS, false));
        rules.add(new DictionaryRule(dictionary));

        PasswordData passwordData = new PasswordData(password);
        String localPart = emailLocalPart(email);
        if (localPart != null) {
            rules.add(new UsernameRule(true, true));
            passwordData.setUsername(localPart);
        }

        PasswordValidator validator = new PasswordValidator(rules);
        RuleResult result = validator.validate(passwordData);
        if (result.isValid()) {
            return PasswordValidationResult.builder()
                    .valid(true)
                    .message("Password meets all requirements")
                    .build();
        }

        List<String> messages = validator.getMessages(result);
        return PasswordValidationResult.builder()
                .valid(false)
                .errors(messages)
                .message(String.join("; ", messages))
                .build();
    }

    /**
     * @throws AuthenticationException PASSWORD_POLICY_VIOLATION listing the broken rules
     */
    public void enforce(String password, String email) {
        PasswordValidationResult result = validatePassword(password, email);
        if (!result.isValid()) {
            log.debug("Password rejected by policy: {}", result.getMessage());
            throw new AuthenticationException(ErrorKind.PASSWORD_POLICY_VIOLATION,
                    "Password does not meet requirements: " + result.getMessage());
        }
    }

    private static String emailLocalPart(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        // very short local parts would reject too many passwords
        return at >= 3 ? email.substring(0, at) : null;
    }

    /**
     * Result of password validation.
     */
    @Data
    @Builder
    public static class PasswordValidationResult {
        private boolean valid;
        private String message;
        private List<String> errors;
    }
}
