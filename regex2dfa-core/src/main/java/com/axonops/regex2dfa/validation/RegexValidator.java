/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.axonops.regex2dfa.validation;

import com.axonops.regex2dfa.automaton.AutomatonExport;
import com.axonops.regex2dfa.automaton.Symbols;
import com.axonops.regex2dfa.automaton.TransitionRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks user input before it reaches the compiler or the simulator, collecting every problem
 * instead of stopping at the first.
 *
 * <p>{@link #validateRegex(String)} accepts exactly the regexes that
 * {@link com.axonops.regex2dfa.algorithm.RegexParser} accepts, and adds warnings for constructs
 * that are legal but probably unintended.
 *
 * <p>Instances are stateless and thread-safe.
 *
 * @since 1.0.0
 */
public final class RegexValidator {

    /** Inputs longer than this get a warning; simulation traces grow with the input. */
    public static final int LONG_INPUT_THRESHOLD = 100;

    // same operand text on both sides of '|', e.g. a|a or ab|ab
    private static final Pattern REDUNDANT_ALTERNATION = Pattern.compile("(?<![^|()])([^|()]+)\\|\\1(?![^|()])");

    /**
     * Validates regex syntax.
     *
     * @param regex regex text
     * @return errors for anything the parser would reject
     */
    public ValidationResult validateRegex(String regex) {
        Objects.requireNonNull(regex, "regex cannot be null");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (regex.isEmpty()) {
            warnings.add("Empty regex matches only the empty string");
            return ValidationResult.of(errors, warnings, List.of());
        }

        Set<Character> invalid = new LinkedHashSet<>();
        for (char c : regex.toCharArray()) {
            if (!Symbols.isOperand(c) && !Symbols.isUnaryOperator(c) && c != Symbols.ALTERNATION
                && c != Symbols.OPEN_GROUP && c != Symbols.CLOSE_GROUP) {
                invalid.add(c);
            }
        }
        if (!invalid.isEmpty()) {
            errors.add("Invalid characters: " + invalid.stream()
                .map(c -> Character.isWhitespace(c) ? "whitespace" : "'" + c + "'")
                .distinct()
                .collect(Collectors.joining(", ")));
        }

        checkParentheses(regex, errors);
        checkOperators(regex, errors, warnings);

        if (regex.indexOf(Symbols.ALTERNATION) >= 0 && REDUNDANT_ALTERNATION.matcher(regex).find()) {
            warnings.add("Possibly redundant alternation (e.g. a|a)");
        }
        return ValidationResult.of(errors, warnings, suggestions(errors));
    }

    private static void checkParentheses(String regex, List<String> errors) {
        int balance = 0;
        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);
            if (c == Symbols.OPEN_GROUP) {
                balance++;
            } else if (c == Symbols.CLOSE_GROUP) {
                balance--;
                if (balance < 0) {
                    errors.add("Unmatched ')' at position " + i);
                    return;
                }
            }
        }
        if (balance > 0) {
            errors.add(balance + " unclosed '('");
        }
    }

    private static void checkOperators(String regex, List<String> errors, List<String> warnings) {
        int last = regex.length() - 1;
        if (regex.charAt(0) == Symbols.ALTERNATION) {
            errors.add("Regex cannot start with binary operator '|'");
        }
        if (regex.charAt(last) == Symbols.ALTERNATION && last > 0) {
            errors.add("Regex cannot end with binary operator '|'");
        }

        for (int i = 0; i <= last; i++) {
            char current = regex.charAt(i);
            char previous = i > 0 ? regex.charAt(i - 1) : 0;

            if (Symbols.isUnaryOperator(current)
                && (i == 0 || previous == Symbols.OPEN_GROUP || previous == Symbols.ALTERNATION)) {
                errors.add("Operator '" + current + "' at position " + i + " has no operand");
            }
            if (i == last) {
                break;
            }

            char next = regex.charAt(i + 1);
            if (current == Symbols.ALTERNATION && next == Symbols.ALTERNATION) {
                errors.add("Consecutive binary operators at position " + i + ": ||");
            }
            if (current == Symbols.OPEN_GROUP && next == Symbols.ALTERNATION) {
                errors.add("Binary operator after '(' at position " + (i + 1));
            }
            if (current == Symbols.ALTERNATION && next == Symbols.CLOSE_GROUP) {
                errors.add("Binary operator before ')' at position " + i);
            }
            if (current == Symbols.OPEN_GROUP && next == Symbols.CLOSE_GROUP) {
                errors.add("Empty group at position " + i);
            }
            if (Symbols.isUnaryOperator(current) && Symbols.isUnaryOperator(next)) {
                warnings.add("Consecutive unary operators at position " + i + ": " + current + next);
            }
        }
    }

    private static List<String> suggestions(List<String> errors) {
        List<String> suggestions = new ArrayList<>();
        if (errors.stream().anyMatch(e -> e.contains("(") || e.contains(")"))) {
            suggestions.add("Check that every '(' has a matching ')' and that groups are not empty, e.g. (a|b)*c");
        }
        if (errors.stream().anyMatch(e -> e.contains("'|'") || e.contains("||"))) {
            suggestions.add("'|' needs an operand on both sides: a|b, not |a or a|");
        }
        if (errors.stream().anyMatch(e -> e.contains("has no operand"))) {
            suggestions.add("'*', '+' and '?' apply to the symbol or group right before them: a*, (ab)+");
        }
        if (errors.stream().anyMatch(e -> e.startsWith("Invalid characters"))) {
            suggestions.add("Use only letters, digits, 'ε' and the operators | * + ? ( )");
        }
        return suggestions;
    }

    /**
     * Validates a simulation input against an automaton alphabet.
     *
     * @param input string to simulate
     * @param alphabet symbols the automaton knows
     * @return errors for symbols outside {@code alphabet}
     */
    public ValidationResult validateInputString(String input, Set<Character> alphabet) {
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(alphabet, "alphabet cannot be null");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (input.isEmpty()) {
            warnings.add("Empty input - only the start state's acceptance is tested");
            return ValidationResult.of(errors, warnings, List.of());
        }

        Set<Character> invalid = new LinkedHashSet<>();
        for (char c : input.toCharArray()) {
            if (!alphabet.contains(c)) {
                invalid.add(c);
            }
        }
        if (!invalid.isEmpty()) {
            errors.add("Symbols not in the alphabet: "
                + invalid.stream().map(String::valueOf).collect(Collectors.joining(", ")));
            errors.add("Valid alphabet: {"
                + new TreeSet<>(alphabet).stream().map(String::valueOf).collect(Collectors.joining(", ")) + "}");
        }
        if (input.length() > LONG_INPUT_THRESHOLD) {
            warnings.add("Input longer than " + LONG_INPUT_THRESHOLD + " symbols - simulation trace will be large");
        }
        return ValidationResult.of(errors, warnings, List.of());
    }

    /**
     * Validates an export record, e.g. one assembled by hand or read from a file, before import.
     *
     * @param export record to check
     * @return errors for dangling ids, unknown symbols and, for deterministic kinds, epsilon edges
     *         or several targets per (state, symbol)
     */
    public ValidationResult validateExport(AutomatonExport export) {
        Objects.requireNonNull(export, "export cannot be null");
        List<String> errors = new ArrayList<>();
        Set<Integer> states = new HashSet<>(export.states());

        if (states.isEmpty()) {
            errors.add("Automaton has no states");
        }
        if (states.size() != export.states().size()) {
            errors.add("Duplicate state ids");
        }
        for (char symbol : export.alphabet()) {
            if (!Symbols.isInputSymbol(symbol)) {
                errors.add("Alphabet symbol '" + symbol + "' is not a letter or digit");
            }
        }
        if (!states.contains(export.start())) {
            errors.add("Start state " + export.start() + " is not in the state set");
        }
        for (int accept : export.acceptStates()) {
            if (!states.contains(accept)) {
                errors.add("Accept state " + accept + " is not in the state set");
            }
        }

        boolean deterministic = export.kind().isDeterministic();
        Map<Long, Integer> targets = new HashMap<>();
        for (int i = 0; i < export.transitions().size(); i++) {
            TransitionRecord t = export.transitions().get(i);
            if (!states.contains(t.from())) {
                errors.add("Transition " + i + ": source " + t.from() + " is not in the state set");
            }
            if (!states.contains(t.to())) {
                errors.add("Transition " + i + ": target " + t.to() + " is not in the state set");
            }
            if (t.isEpsilon()) {
                if (deterministic) {
                    errors.add("Transition " + i + ": epsilon edge in a " + export.kind().label());
                }
            } else if (!export.alphabet().contains(t.symbol())) {
                errors.add("Transition " + i + ": symbol '" + t.symbol() + "' is not in the alphabet");
            } else if (deterministic) {
                Integer previous = targets.putIfAbsent(((long) t.from() << 16) | t.symbol(), t.to());
                if (previous != null && previous != t.to()) {
                    errors.add("Transition " + i + ": state " + t.from() + " already moves to " + previous
                        + " on '" + t.symbol() + "'");
                }
            }
        }
        return ValidationResult.of(errors, List.of(), List.of());
    }

    /**
     * Input symbols used by a regex.
     *
     * @param regex regex text
     * @return letters and digits occurring in {@code regex}, ascending
     */
    public static SortedSet<Character> extractAlphabet(String regex) {
        SortedSet<Character> alphabet = new TreeSet<>();
        for (char c : regex.toCharArray()) {
            if (Symbols.isInputSymbol(c)) {
                alphabet.add(c);
            }
        }
        return alphabet;
    }
}
