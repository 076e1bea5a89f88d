package com.deepansh.pawsagent.records;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes free-form user input (mostly Spanish) before it reaches the records service.
 *
 * Every method throws {@link IllegalArgumentException} when the input cannot be
 * interpreted; the message starts with "Invalid species" or "Invalid date".
 */
@Component
public class InputNormalizer {

    private static final List<String> CAT_WORDS = List.of("GATA", "GATITO", "GATITA", "FELINO", "MICHI", "MIAU");
    private static final List<String> DOG_WORDS =
            List.of("PERRA", "PERRITO", "PERRITA", "CANINO", "CACHORRO", "CACHORRA", "GUAU");

    private static final Map<String, Integer> SPANISH_MONTHS = Map.ofEntries(
            Map.entry("enero", 1), Map.entry("febrero", 2), Map.entry("marzo", 3),
            Map.entry("abril", 4), Map.entry("mayo", 5), Map.entry("junio", 6),
            Map.entry("julio", 7), Map.entry("agosto", 8), Map.entry("septiembre", 9),
            Map.entry("setiembre", 9), Map.entry("octubre", 10), Map.entry("noviembre", 11),
            Map.entry("diciembre", 12));

    // "15 de enero de 2022", "15 de 01 de 2022", "15 enero 2022"
    private static final Pattern SPANISH_DATE =
            Pattern.compile("(\\d{1,2})\\s+(?:de\\s+)?([a-z]+|\\d{1,2})\\s+(?:de\\s+|del\\s+)?(\\d{4})");
    // "15/01/2022", "15-01-2022"
    private static final Pattern NUMERIC_DATE = Pattern.compile("(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{4})");
    private static final Pattern AGE_YEARS = Pattern.compile("(\\d+)\\s*(años|año|anos|ano|years|year)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern AGE_MONTHS = Pattern.compile("(\\d+)\\s*(meses|mes|months|month)",
            Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public InputNormalizer() {
        this(Clock.systemDefaultZone());
    }

    InputNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Species normalizeSpecies(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Invalid species: empty. Must be CAT/GATO or DOG/PERRO");
        }
        String normalized = input.trim().toUpperCase(Locale.ROOT);

        if (normalized.equals("CAT") || normalized.equals("GATO")) return Species.CAT;
        if (normalized.equals("DOG") || normalized.equals("PERRO")) return Species.DOG;

        if (CAT_WORDS.stream().anyMatch(normalized::contains)) return Species.CAT;
        if (DOG_WORDS.stream().anyMatch(normalized::contains)) return Species.DOG;

        throw new IllegalArgumentException("Invalid species: " + input + ". Must be CAT/GATO or DOG/PERRO");
    }

    /**
     * Accepts ISO dates and timestamps, dd/MM/yyyy, Spanish long dates and approximate
     * ages ("2 años" → January 1st of that year, "3 meses" → today minus 3 months).
     */
    public LocalDate normalizeDate(String input) {
        if (input == null || input.isBlank()) {
            throw invalidDate(input);
        }
        String text = input.trim().toLowerCase(Locale.ROOT);

        Optional<LocalDate> iso = parseIso(input.trim());
        if (iso.isPresent()) {
            return iso.get();
        }

        Matcher numeric = NUMERIC_DATE.matcher(text);
        if (numeric.find()) {
            return date(numeric.group(3), numeric.group(2), numeric.group(1), input);
        }

        Matcher spanish = SPANISH_DATE.matcher(text);
        if (spanish.find()) {
            String month = spanish.group(2);
            Integer monthNumber = SPANISH_MONTHS.get(month);
            if (monthNumber != null) {
                month = String.valueOf(monthNumber);
            }
            return date(spanish.group(3), month, spanish.group(1), input);
        }

        LocalDate today = LocalDate.now(clock);
        Matcher years = AGE_YEARS.matcher(text);
        if (years.find()) {
            return LocalDate.of(today.getYear() - Integer.parseInt(years.group(1)), 1, 1);
        }
        Matcher months = AGE_MONTHS.matcher(text);
        if (months.find()) {
            return today.minusMonths(Integer.parseInt(months.group(1)));
        }

        throw invalidDate(input);
    }

    /** "  lUNA de   miel " → "Luna De Miel" */
    public String normalizeName(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Invalid name: null");
        }
        return Arrays.stream(input.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static Optional<LocalDate> parseIso(String text) {
        try {
            if (text.length() > 10 && text.charAt(10) == 'T') {
                return Optional.of(LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(text)));
            }
            return Optional.of(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static LocalDate date(String year, String month, String day, String original) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (NumberFormatException | DateTimeException e) {
            throw invalidDate(original);
        }
    }

    private static IllegalArgumentException invalidDate(String input) {
        return new IllegalArgumentException("Invalid date format: " + input
                + ". Please provide a specific date like \"2022-01-15\" or \"15 de enero de 2022\"");
    }
}
