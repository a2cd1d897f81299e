package com.lottointel.activo.service;

import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.model.DrawRecord;
import com.lottointel.activo.model.NormalizationFlag;
import com.lottointel.activo.model.NormalizationResult;
import com.lottointel.activo.model.RawRow;
import com.lottointel.activo.model.RejectionReason;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one scraped row into a canonical {@link DrawRecord} or a {@link RejectionReason}.
 *
 * Rules run in order and the first failure wins: date, number, animal, then the
 * number/animal cross-check. The time never rejects a row. No I/O; the clock only stamps processed_at.
 */
@Component
public class DrawRecordNormalizer {

    static final LocalTime DEFAULT_TIME = LocalTime.MIDNIGHT;

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;

    private static final List<DateTimeFormatter> NUMERIC_DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    // "15 de enero de 2025", optionally preceded by a weekday ("miércoles, 15 de enero del 2025")
    private static final Pattern SPANISH_LONG_DATE =
            Pattern.compile("(\\d{1,2})\\s+de\\s+([a-z]+)\\s+(?:de|del)\\s+(\\d{4})");

    private static final Map<String, Integer> SPANISH_MONTHS = Map.ofEntries(
            Map.entry("enero", 1), Map.entry("febrero", 2), Map.entry("marzo", 3),
            Map.entry("abril", 4), Map.entry("mayo", 5), Map.entry("junio", 6),
            Map.entry("julio", 7), Map.entry("agosto", 8), Map.entry("septiembre", 9),
            Map.entry("setiembre", 9), Map.entry("octubre", 10), Map.entry("noviembre", 11),
            Map.entry("diciembre", 12)
    );

    private static final Pattern TIME_12H = Pattern.compile(
            "^(\\d{1,2})(?::(\\d{2}))?(?::(\\d{2}))?\\s*([ap])\\.?\\s*m\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_24H = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");

    private static final Pattern NUMBER = Pattern.compile("^#?\\s*(\\d{1,2})$");

    private final MismatchPolicy mismatchPolicy;
    private final String sourceName;
    private final Clock clock;

    public DrawRecordNormalizer(LottoScraperProperties properties, Clock clock) {
        MismatchPolicy policy = properties.getValidation().getMismatchPolicy();
        this.mismatchPolicy = policy != null ? policy : MismatchPolicy.MARK_INVALID;
        String name = properties.getSource().getName();
        this.sourceName = name == null || name.isBlank() ? "lotto-activo" : name;
        this.clock = clock;
    }

    public MismatchPolicy getMismatchPolicy() {
        return mismatchPolicy;
    }

    public NormalizationResult normalize(RawRow raw) {
        EnumSet<NormalizationFlag> flags = EnumSet.noneOf(NormalizationFlag.class);

        Optional<LocalDate> date = parseDate(raw.getDate());
        if (date.isEmpty()) {
            return NormalizationResult.rejected(RejectionReason.BAD_DATE);
        }

        // A bad time never costs the row: the draw is kept at midnight and flagged.
        LocalTime time;
        if (raw.getTime() == null || raw.getTime().isBlank()) {
            time = DEFAULT_TIME;
            flags.add(NormalizationFlag.TIME_DEFAULTED);
        } else {
            Optional<LocalTime> parsed = parseTime(raw.getTime());
            if (parsed.isEmpty()) {
                flags.add(NormalizationFlag.TIME_DEFAULTED);
                flags.add(NormalizationFlag.TIME_UNPARSED);
            }
            time = parsed.orElse(DEFAULT_TIME);
        }

        Optional<String> number = parseNumber(raw.getNumber());
        if (number.isEmpty()) {
            return NormalizationResult.rejected(RejectionReason.BAD_NUMBER);
        }

        String animal = AnimalTable.fold(raw.getAnimal());
        if (!AnimalTable.isValidAnimal(animal)) {
            return NormalizationResult.rejected(RejectionReason.UNKNOWN_ANIMAL);
        }

        boolean consistent = AnimalTable.animalFor(number.get())
                .map(animal::equals)
                .orElse(false);

        DrawRecord.DrawRecordBuilder record = DrawRecord.builder()
                .date(date.get())
                .time(time)
                .number(number.get())
                .animal(animal)
                .source(sourceName)
                .processedAt(LocalDateTime.now(clock))
                .rowIndex(raw.getRowIndex())
                .valid(true);

        if (consistent) {
            return NormalizationResult.accepted(record.build(), flags);
        }

        flags.add(NormalizationFlag.NUMBER_ANIMAL_MISMATCH);
        return switch (mismatchPolicy) {
            case REJECT -> NormalizationResult.rejected(RejectionReason.NUMBER_ANIMAL_MISMATCH);
            case MARK_INVALID -> NormalizationResult.markedInvalid(
                    record.valid(false).build(), RejectionReason.NUMBER_ANIMAL_MISMATCH, flags);
            case KEEP -> NormalizationResult.accepted(record.build(), flags);
        };
    }

    // ── Field parsers ────────────────────────────────────────────────────────

    Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String text = value.trim();

        for (DateTimeFormatter format : NUMERIC_DATE_FORMATS) {
            try {
                return inYearRange(LocalDate.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // try the next accepted format
            }
        }

        Matcher m = SPANISH_LONG_DATE.matcher(foldLower(text));
        if (!m.find()) return Optional.empty();

        Integer month = SPANISH_MONTHS.get(m.group(2));
        if (month == null) return Optional.empty();
        try {
            return inYearRange(LocalDate.of(Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(1))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    Optional<LocalTime> parseTime(String value) {
        if (value == null) return Optional.empty();
        String text = value.trim();

        Matcher m12 = TIME_12H.matcher(text);
        if (m12.matches()) {
            int hour = Integer.parseInt(m12.group(1));
            int minute = m12.group(2) == null ? 0 : Integer.parseInt(m12.group(2));
            int second = m12.group(3) == null ? 0 : Integer.parseInt(m12.group(3));
            if (hour < 1 || hour > 12) return Optional.empty();
            boolean pm = m12.group(4).equalsIgnoreCase("p");
            if (pm && hour != 12) hour += 12;
            if (!pm && hour == 12) hour = 0;
            return timeOf(hour, minute, second);
        }

        Matcher m24 = TIME_24H.matcher(text);
        if (m24.matches()) {
            int second = m24.group(3) == null ? 0 : Integer.parseInt(m24.group(3));
            return timeOf(Integer.parseInt(m24.group(1)), Integer.parseInt(m24.group(2)), second);
        }
        return Optional.empty();
    }

    /**
     * Canonical draw number: "5" → "05", "0" and "00" kept apart.
     */
    Optional<String> parseNumber(String value) {
        if (value == null) return Optional.empty();
        Matcher m = NUMBER.matcher(value.trim());
        if (!m.matches()) return Optional.empty();

        String digits = m.group(1);
        String canonical = digits.length() == 1 && !digits.equals("0") ? "0" + digits : digits;
        return AnimalTable.isValidNumber(canonical) ? Optional.of(canonical) : Optional.empty();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Optional<LocalDate> inYearRange(LocalDate date) {
        return date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR ? Optional.of(date) : Optional.empty();
    }

    private static Optional<LocalTime> timeOf(int hour, int minute, int second) {
        try {
            return Optional.of(LocalTime.of(hour, minute, second));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static String foldLower(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}+", "").toLowerCase(Locale.ROOT);
    }
}
