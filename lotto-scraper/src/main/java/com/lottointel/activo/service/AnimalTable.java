package com.lottointel.activo.service;

import java.text.Normalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The fixed Lotto Activo draw table: 38 numbers, each bound to one animal.
 * "0" (DELFIN) and "00" (BALLENA) are different draws.
 */
public final class AnimalTable {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> NUMBER_TO_ANIMAL;
    private static final Map<String, String> ANIMAL_TO_NUMBER;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("0", "DELFIN");
        m.put("00", "BALLENA");
        m.put("01", "CARNERO");
        m.put("02", "TORO");
        m.put("03", "CIEMPIES");
        m.put("04", "ALACRAN");
        m.put("05", "LEON");
        m.put("06", "RANA");
        m.put("07", "PERICO");
        m.put("08", "RATON");
        m.put("09", "AGUILA");
        m.put("10", "TIGRE");
        m.put("11", "GATO");
        m.put("12", "CABALLO");
        m.put("13", "MONO");
        m.put("14", "PALOMA");
        m.put("15", "ZORRO");
        m.put("16", "OSO");
        m.put("17", "PAVO");
        m.put("18", "BURRO");
        m.put("19", "CHIVO");
        m.put("20", "COCHINO");
        m.put("21", "GALLO");
        m.put("22", "CAMELLO");
        m.put("23", "CEBRA");
        m.put("24", "IGUANA");
        m.put("25", "GALLINA");
        m.put("26", "VACA");
        m.put("27", "PERRO");
        m.put("28", "ZAMURO");
        m.put("29", "ELEFANTE");
        m.put("30", "CAIMAN");
        m.put("31", "LAPA");
        m.put("32", "ARDILLA");
        m.put("33", "PESCADO");
        m.put("34", "VENADO");
        m.put("35", "JIRAFA");
        m.put("36", "CULEBRA");
        NUMBER_TO_ANIMAL = Collections.unmodifiableMap(m);

        Map<String, String> inverse = new LinkedHashMap<>();
        m.forEach((number, animal) -> inverse.put(animal, number));
        ANIMAL_TO_NUMBER = Collections.unmodifiableMap(inverse);
    }

    private AnimalTable() {}

    public static Map<String, String> numberToAnimal() {
        return NUMBER_TO_ANIMAL;
    }

    public static boolean isValidNumber(String number) {
        return number != null && NUMBER_TO_ANIMAL.containsKey(number);
    }

    public static boolean isValidAnimal(String animal) {
        return animal != null && ANIMAL_TO_NUMBER.containsKey(animal);
    }

    public static Optional<String> animalFor(String number) {
        return Optional.ofNullable(number).map(NUMBER_TO_ANIMAL::get);
    }

    /** Number for a label in any case or accent form, e.g. "León" → "05". */
    public static Optional<String> numberFor(String label) {
        return Optional.ofNullable(fold(label)).map(ANIMAL_TO_NUMBER::get);
    }

    /**
     * Trim, strip accents and upper-case a label: " León " → "LEON".
     * Returns null for null or blank input.
     */
    public static String fold(String label) {
        if (label == null || label.isBlank()) return null;
        String decomposed = Normalizer.normalize(label.trim(), Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").toUpperCase(Locale.ROOT);
    }
}
