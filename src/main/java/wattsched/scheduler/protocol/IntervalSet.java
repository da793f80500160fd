package wattsched.scheduler.protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Host id sets in the backend's interval notation, e.g. {@code "0-3 5 7-8"}.
 */
public final class IntervalSet {

    /** Largest host id accepted from the backend */
    public static final int MAX_HOST_ID = 1 << 20;

    private IntervalSet() {
    }

    /**
     * Parse an interval string into ascending, distinct host ids.
     * Intervals may be separated by spaces or commas.
     *
     * @throws IllegalArgumentException on malformed input or ids above {@link #MAX_HOST_ID}
     */
    public static List<Integer> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        TreeSet<Integer> ids = new TreeSet<>();
        for (String part : text.trim().split("[\\s,]+")) {
            int dash = part.indexOf('-', 1);
            if (dash < 0) {
                ids.add(parseId(part));
                continue;
            }
            int lo = parseId(part.substring(0, dash));
            int hi = parseId(part.substring(dash + 1));
            if (hi < lo) {
                throw new IllegalArgumentException("reversed interval: " + part);
            }
            for (long id = lo; id <= hi; id++) {
                ids.add((int) id);
            }
        }
        return List.copyOf(ids);
    }

    /** Format host ids as compact ascending intervals */
    public static String format(Collection<Integer> hostIds) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(hostIds));
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < sorted.size()) {
            int start = sorted.get(i);
            int end = start;
            while (i + 1 < sorted.size() && sorted.get(i + 1) == end + 1) {
                end = sorted.get(++i);
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(start);
            if (end > start) {
                sb.append('-').append(end);
            }
            i++;
        }
        return sb.toString();
    }

    private static int parseId(String s) {
        try {
            int id = Integer.parseInt(s.trim());
            if (id < 0) {
                throw new IllegalArgumentException("negative host id: " + s);
            }
            if (id > MAX_HOST_ID) {
                throw new IllegalArgumentException("host id out of range: " + s);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad host id: '" + s + "'", e);
        }
    }
}
