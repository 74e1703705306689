package org.filemetrics.datasources;

import org.filemetrics.metrics.CsvMetrics;
import org.filemetrics.metrics.FailureInfo;
import org.filemetrics.metrics.FailureKind;
import org.filemetrics.metrics.FileFormat;
import org.filemetrics.metrics.ProcessingResult;
import org.filemetrics.metrics.StatusHelper;
import org.filemetrics.processing.AbstractLineParser;
import org.filemetrics.util.Utils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sales CSV: a header line, then {@code date,product,category,price,quantity,discount} records.
 * <p>
 * Numbers are read from their leading numeric prefix, so {@code 19.99USD} is a price of 19.99.
 * A valid record contributes {@code price * quantity * (1 - discount / 100)} to the total sales,
 * summed exactly and rounded half-up to 2 decimals at the end.
 */
public class CsvSalesParser extends AbstractLineParser {

    public static final int FIELD_COUNT = 6;
    static final int MIN_DATE_LENGTH = 8;
    static final String NO_DATA_REASON = "Empty file or no data after header";

    private static final Pattern DECIMAL_PREFIX = Pattern.compile("^[+-]?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final Pattern INTEGER_PREFIX = Pattern.compile("^[+-]?\\d+");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final int MAX_SCALE = 1000;

    @Override
    public FileFormat format() {
        return FileFormat.CSV;
    }

    @Override
    public ProcessingResult parse(final String fileName, final byte[] content) {
        final List<String> lines = splitLines(content);
        final List<String> dataLines = lines.size() > 1 ? lines.subList(1, lines.size()) : List.of();
        if (dataLines.stream().allMatch(AbstractLineParser::isBlank)) {
            logger.warning(fileName + ": " + NO_DATA_REASON);
            return ProcessingResult.failure(fileName, FileFormat.CSV, FailureInfo.of(FailureKind.NO_DATA, NO_DATA_REASON));
        }

        final SalesTotals totals = new SalesTotals();
        final LineScan scan = scan(fileName, dataLines, 1, line -> validateRecord(line, totals));

        final long total = scan.validCount() + scan.invalidCount();
        final CsvMetrics metrics = new CsvMetrics(scan.validCount(), scan.invalidCount(), total,
                totals.sales.setScale(2, RoundingMode.HALF_UP), totals.products.size(),
                Utils.percentage(scan.validCount(), total), Utils.percentage(scan.invalidCount(), total));
        return StatusHelper.createLineResult(fileName, metrics, scan.validCount(), scan.errors());
    }

    /**
     * Checks every field of the record and reports all problems at once, in column order.
     */
    Optional<String> validateRecord(final String line, final SalesTotals totals) {
        final String[] fields = line.split(",", -1);
        if (fields.length != FIELD_COUNT)
            return Optional.of("Incomplete line (" + fields.length + " fields instead of " + FIELD_COUNT + ")");

        final List<String> problems = new ArrayList<>();
        final String date = fields[0].trim();
        final String product = fields[1].trim();
        final String category = fields[2].trim();

        if (date.isEmpty()) problems.add("Empty date");
        else if (date.length() < MIN_DATE_LENGTH) problems.add("Invalid date format (too short)");
        if (product.isEmpty()) problems.add("Empty product name");
        if (category.isEmpty()) problems.add("Empty category");

        final Optional<BigDecimal> price = parseDecimalPrefix(fields[3]);
        if (price.isEmpty()) problems.add(unparsable("price", fields[3]));
        else if (price.get().signum() <= 0) problems.add("Price must be positive (found: " + price.get() + ")");

        final Optional<BigDecimal> quantity = parseIntegerPrefix(fields[4]);
        if (quantity.isEmpty()) problems.add(unparsable("quantity", fields[4]));
        else if (quantity.get().signum() <= 0) problems.add("Quantity must be positive (found: " + quantity.get() + ")");

        final Optional<BigDecimal> discount = parseDecimalPrefix(fields[5]);
        if (discount.isEmpty()) problems.add(unparsable("discount", fields[5]));
        else if (discount.get().signum() < 0) problems.add("Negative discount: " + discount.get() + "%");
        else if (discount.get().compareTo(HUNDRED) > 0) problems.add("Discount too high: " + discount.get() + "% (max 100%)");

        if (!problems.isEmpty()) return Optional.of(String.join(", ", problems));

        totals.add(product, netSale(price.get(), quantity.get(), discount.get()));
        return Optional.empty();
    }

    static BigDecimal netSale(final BigDecimal price, final BigDecimal quantity, final BigDecimal discount) {
        return price.multiply(quantity).multiply(HUNDRED.subtract(discount)).movePointLeft(2);
    }

    static Optional<BigDecimal> parseDecimalPrefix(final String raw) {
        return parsePrefix(DECIMAL_PREFIX, raw);
    }

    static Optional<BigDecimal> parseIntegerPrefix(final String raw) {
        return parsePrefix(INTEGER_PREFIX, raw);
    }

    /**
     * Leading numeric prefix of {@code raw}. A prefix whose exponent puts the scale beyond
     * {@value #MAX_SCALE} digits either way is not a number for this file.
     */
    private static Optional<BigDecimal> parsePrefix(final Pattern pattern, final String raw) {
        final Matcher matcher = pattern.matcher(raw.trim());
        if (!matcher.find()) return Optional.empty();
        final BigDecimal value;
        try {
            value = new BigDecimal(matcher.group());
        } catch (NumberFormatException e) { // exponent beyond int range
            return Optional.empty();
        }
        return Math.abs((long) value.scale()) > MAX_SCALE ? Optional.empty() : Optional.of(value);
    }

    private static String unparsable(final String field, final String raw) {
        final String trimmed = raw.trim();
        return trimmed.isEmpty() ? "Empty " + field : "Invalid " + field + ": '" + trimmed + "'";
    }

    static final class SalesTotals {
        private BigDecimal sales = BigDecimal.ZERO;
        private final Set<String> products = new HashSet<>();

        void add(final String product, final BigDecimal netSale) {
            sales = sales.add(netSale);
            products.add(product);
        }
    }
}
