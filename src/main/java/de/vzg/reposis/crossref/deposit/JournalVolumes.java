package de.vzg.reposis.crossref.deposit;

import java.time.LocalDate;

/**
 * Volume numbers of journals that publish one volume per calendar year.
 */
public final class JournalVolumes {

    private JournalVolumes() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * @return the volume of {@code pubDate}, or null if either argument is null
     */
    public static String calculate(LocalDate pubDate, Integer yearOfFirstVolume) {
        if (pubDate == null || yearOfFirstVolume == null) {
            return null;
        }
        return String.valueOf(pubDate.getYear() - yearOfFirstVolume + 1);
    }
}
