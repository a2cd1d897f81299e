package com.lottointel.activo.service;

import com.lottointel.activo.TestFixtures;
import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.model.DrawRecord;
import com.lottointel.activo.model.NormalizationFlag;
import com.lottointel.activo.model.NormalizationResult;
import com.lottointel.activo.model.RawRow;
import com.lottointel.activo.model.RejectionReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DrawRecordNormalizer Tests")
class DrawRecordNormalizerTest {

    private final DrawRecordNormalizer normalizer = normalizer(MismatchPolicy.MARK_INVALID);

    private static DrawRecordNormalizer normalizer(MismatchPolicy policy) {
        LottoScraperProperties properties = TestFixtures.properties(Path.of("target"));
        properties.getValidation().setMismatchPolicy(policy);
        return new DrawRecordNormalizer(properties, TestFixtures.fixedClock());
    }

    private static RawRow row(String date, String number, String animal, String time) {
        return RawRow.builder().date(date).number(number).animal(animal).time(time).rowIndex(7).build();
    }

    @Test
    @DisplayName("Spanish long date, bare digit and accented animal normalize to a valid record")
    void normalizesSpanishExample() {
        NormalizationResult result = normalizer.normalize(row("15 de enero de 2025", "5", "León", "2:30 PM"));

        assertTrue(result.isValid());
        DrawRecord record = result.record();
        assertEquals(LocalDate.of(2025, 1, 15), record.getDate());
        assertEquals(LocalTime.of(14, 30, 0), record.getTime());
        assertEquals("05", record.getNumber());
        assertEquals("LEON", record.getAnimal());
        assertEquals("lotto-activo", record.getSource());
        assertEquals(7, record.getRowIndex());
        assertEquals(LocalDateTime.of(2025, 1, 20, 16, 0), record.getProcessedAt());
        assertTrue(result.flags().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "2025-01-15, 2025-01-15",
            "2025-1-5, 2025-01-05",
            "15/01/2025, 2025-01-15",
            "5-1-2025, 2025-01-05",
            "'miércoles, 15 de enero del 2025', 2025-01-15",
            "3 de Setiembre de 2024, 2024-09-03"
    })
    @DisplayName("Accepted date formats")
    void parsesDates(String raw, LocalDate expected) {
        assertEquals(expected, normalizer.parseDate(raw).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"2025-02-30", "31/04/2025", "15 de foo de 2025", "1850-01-01", "yesterday"})
    @DisplayName("Impossible or unknown dates are rejected as BAD_DATE")
    void rejectsBadDates(String raw) {
        NormalizationResult result = normalizer.normalize(row(raw, "05", "LEON", "10:00 AM"));

        assertFalse(result.hasRecord());
        assertEquals(RejectionReason.BAD_DATE, result.rejection());
    }

    @ParameterizedTest
    @CsvSource({
            "2:30 PM, 14:30:00",
            "12:00 PM, 12:00:00",
            "12:00 AM, 00:00:00",
            "7 p.m., 19:00:00",
            "08:00 a. m., 08:00:00",
            "19:00, 19:00:00",
            "09:15:30, 09:15:30"
    })
    @DisplayName("Accepted time formats")
    void parsesTimes(String raw, LocalTime expected) {
        assertEquals(expected, normalizer.parseTime(raw).orElseThrow());
    }

    @Test
    @DisplayName("Missing time defaults to midnight and flags the record")
    void missingTimeIsFlagged() {
        NormalizationResult result = normalizer.normalize(row("2025-01-15", "05", "LEON", " "));

        assertTrue(result.isValid());
        assertEquals(LocalTime.MIDNIGHT, result.record().getTime());
        assertTrue(result.flags().contains(NormalizationFlag.TIME_DEFAULTED));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Sorteo 2", "25:00", "13:00 PM", "noon"})
    @DisplayName("Present but unparseable time keeps the row at midnight and flags it")
    void unparseableTimeIsKept(String raw) {
        NormalizationResult result = normalizer.normalize(row("2025-01-15", "05", "LEON", raw));

        assertTrue(result.isValid());
        assertNull(result.rejection());
        assertEquals(LocalTime.MIDNIGHT, result.record().getTime());
        assertEquals("05", result.record().getNumber());
        assertTrue(result.flags().contains(NormalizationFlag.TIME_DEFAULTED));
        assertTrue(result.flags().contains(NormalizationFlag.TIME_UNPARSED));
    }

    @Test
    @DisplayName("Blank time is defaulted but not reported as unparseable")
    void blankTimeIsNotUnparsed() {
        NormalizationResult result = normalizer.normalize(row("2025-01-15", "05", "LEON", ""));

        assertTrue(result.flags().contains(NormalizationFlag.TIME_DEFAULTED));
        assertFalse(result.flags().contains(NormalizationFlag.TIME_UNPARSED));
    }

    @ParameterizedTest
    @CsvSource({
            "5, 05",
            "05, 05",
            "#7, 07",
            "0, 0",
            "00, 00",
            "36, 36"
    })
    @DisplayName("Numbers are zero padded, 0 and 00 stay apart")
    void canonicalNumbers(String raw, String expected) {
        assertEquals(expected, normalizer.parseNumber(raw).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"37", "99", "-1", "abc", ""})
    @DisplayName("Numbers outside the enumeration are rejected as BAD_NUMBER")
    void rejectsBadNumbers(String raw) {
        assertEquals(RejectionReason.BAD_NUMBER,
                normalizer.normalize(row("2025-01-15", raw, "LEON", "10:00 AM")).rejection());
    }

    @Test
    @DisplayName("Unknown animal is rejected as UNKNOWN_ANIMAL")
    void rejectsUnknownAnimal() {
        assertEquals(RejectionReason.UNKNOWN_ANIMAL,
                normalizer.normalize(row("2025-01-15", "05", "Dragón", "10:00 AM")).rejection());
    }

    @Test
    @DisplayName("DELFIN and BALLENA resolve to 0 and 00")
    void zeroAndDoubleZero() {
        assertEquals("0", normalizer.normalize(row("2025-01-15", "0", "Delfín", "9 AM")).record().getNumber());
        assertEquals("00", normalizer.normalize(row("2025-01-15", "00", "Ballena", "9 AM")).record().getNumber());
        assertFalse(normalizer.normalize(row("2025-01-15", "0", "Ballena", "9 AM")).isValid());
    }

    // ── Number / animal mismatch policies ──

    @Test
    @DisplayName("MARK_INVALID keeps the record with valid=false")
    void mismatchMarkedInvalid() {
        NormalizationResult result = normalizer(MismatchPolicy.MARK_INVALID)
                .normalize(row("2025-01-15", "05", "Tigre", "10:00 AM"));

        assertTrue(result.hasRecord());
        assertFalse(result.isValid());
        assertFalse(result.record().isValid());
        assertEquals(RejectionReason.NUMBER_ANIMAL_MISMATCH, result.rejection());
        assertTrue(result.flags().contains(NormalizationFlag.NUMBER_ANIMAL_MISMATCH));
    }

    @Test
    @DisplayName("REJECT drops the row")
    void mismatchRejected() {
        NormalizationResult result = normalizer(MismatchPolicy.REJECT)
                .normalize(row("2025-01-15", "05", "Tigre", "10:00 AM"));

        assertFalse(result.hasRecord());
        assertEquals(RejectionReason.NUMBER_ANIMAL_MISMATCH, result.rejection());
    }

    @Test
    @DisplayName("KEEP accepts the row as scraped and flags it")
    void mismatchKept() {
        NormalizationResult result = normalizer(MismatchPolicy.KEEP)
                .normalize(row("2025-01-15", "05", "Tigre", "10:00 AM"));

        assertTrue(result.isValid());
        assertEquals("05", result.record().getNumber());
        assertEquals("TIGRE", result.record().getAnimal());
        assertNull(result.rejection());
        assertTrue(result.flags().contains(NormalizationFlag.NUMBER_ANIMAL_MISMATCH));
    }

    @Test
    @DisplayName("Missing policy falls back to MARK_INVALID")
    void nullPolicyDefaults() {
        assertEquals(MismatchPolicy.MARK_INVALID, normalizer((MismatchPolicy) null).getMismatchPolicy());
    }
}
