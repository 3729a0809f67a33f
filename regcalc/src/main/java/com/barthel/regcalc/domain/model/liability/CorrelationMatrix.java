package com.barthel.regcalc.domain.model.liability;

import com.barthel.regcalc.domain.exception.InvalidInputException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Symmetric correlation matrix with unit diagonal over named risks.
 *
 * @param risks risk names, index order of the matrix
 * @param values row-major correlations
 */
public record CorrelationMatrix(List<String> risks, List<List<BigDecimal>> values) {

    public CorrelationMatrix {
        if (risks == null || risks.isEmpty()) {
            throw new InvalidInputException("Correlation matrix needs at least one risk");
        }
        risks = List.copyOf(risks);
        int n = risks.size();
        if (values == null || values.size() != n) {
            throw new InvalidInputException("Correlation matrix must have " + n + " rows");
        }
        List<List<BigDecimal>> rows = new ArrayList<>(n);
        for (List<BigDecimal> row : values) {
            if (row == null || row.size() != n) {
                throw new InvalidInputException("Correlation matrix must be square (" + n + "x" + n + ")");
            }
            rows.add(List.copyOf(row));
        }
        for (int i = 0; i < n; i++) {
            if (rows.get(i).get(i).compareTo(BigDecimal.ONE) != 0) {
                throw new InvalidInputException("Diagonal of correlation matrix must be 1 at " + risks.get(i));
            }
            for (int j = 0; j < n; j++) {
                BigDecimal c = rows.get(i).get(j);
                if (c.compareTo(BigDecimal.ONE.negate()) < 0 || c.compareTo(BigDecimal.ONE) > 0) {
                    throw new InvalidInputException("Correlation out of [-1, 1] between "
                            + risks.get(i) + " and " + risks.get(j));
                }
                if (c.compareTo(rows.get(j).get(i)) != 0) {
                    throw new InvalidInputException("Correlation matrix is not symmetric between "
                            + risks.get(i) + " and " + risks.get(j));
                }
            }
        }
        values = List.copyOf(rows);
    }

    /**
     * Builds a matrix from pairwise correlations keyed {@code "a:b"} in either order;
     * missing pairs take {@code fallback}.
     */
    public static CorrelationMatrix fromPairs(List<String> risks, Map<String, BigDecimal> pairs, BigDecimal fallback) {
        List<List<BigDecimal>> rows = new ArrayList<>();
        for (String a : risks) {
            List<BigDecimal> row = new ArrayList<>();
            for (String b : risks) {
                if (a.equals(b)) {
                    row.add(BigDecimal.ONE);
                } else {
                    BigDecimal c = pairs.get(a + ":" + b);
                    if (c == null) {
                        c = pairs.get(b + ":" + a);
                    }
                    row.add(c == null ? fallback : c);
                }
            }
            rows.add(row);
        }
        return new CorrelationMatrix(risks, rows);
    }

    public BigDecimal get(int i, int j) {
        return values.get(i).get(j);
    }

    public int size() {
        return risks.size();
    }
}
