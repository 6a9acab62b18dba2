package com.quantori.bqp.core.parser;

import com.quantori.bqp.api.model.Hit;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/** Orderings and filters over parsed hits. */
@UtilityClass
public class HitOrdering {

  /** Ranking of every parsed result: best bit score first, lower e-value on ties. */
  public static final Comparator<Hit> DEFAULT =
      Comparator.comparingDouble(Hit::getBitScore)
          .reversed()
          .thenComparingDouble(Hit::getEvalue);

  @Getter
  @AllArgsConstructor
  public enum SortField {
    BIT_SCORE(Comparator.comparingDouble(Hit::getBitScore)),
    EVALUE(Comparator.comparingDouble(Hit::getEvalue)),
    IDENTITY(Comparator.comparingDouble(Hit::getIdentityPercent)),
    COVERAGE(Comparator.comparingDouble(Hit::getCoveragePercent)),
    LENGTH(Comparator.comparingInt(Hit::getAlignmentLength));

    private final Comparator<Hit> ascending;

    public static SortField fromValue(String value) {
      String normalized = value.trim().replaceAll("([a-z])([A-Z])", "$1_$2");
      return valueOf(normalized.replace('-', '_').toUpperCase(Locale.ROOT));
    }
  }

  public enum SortOrder {
    ASC,
    DESC
  }

  /** Criteria a hit must meet to be shown; unset criteria accept everything. */
  @Getter
  @Builder
  public static class HitFilter {
    private final Double maxEvalue;
    private final Double minIdentity;
    private final String organism;

    Predicate<Hit> toPredicate() {
      Predicate<Hit> predicate = hit -> true;
      if (maxEvalue != null) {
        predicate = predicate.and(hit -> hit.getEvalue() <= maxEvalue);
      }
      if (minIdentity != null) {
        predicate = predicate.and(hit -> hit.getIdentityPercent() >= minIdentity);
      }
      if (StringUtils.isNotBlank(organism)) {
        predicate =
            predicate.and(
                hit ->
                    StringUtils.containsIgnoreCase(hit.getOrganism(), organism.trim())
                        || StringUtils.containsIgnoreCase(hit.getDescription(), organism.trim()));
      }
      return predicate;
    }
  }

  public static List<Hit> sortDefault(List<Hit> hits) {
    return hits.stream().sorted(DEFAULT).collect(Collectors.toList());
  }

  /** Sorts by one field. Ties keep the default ranking, so the result is stable across calls. */
  public static List<Hit> sort(List<Hit> hits, SortField field, SortOrder order) {
    Comparator<Hit> comparator =
        order == SortOrder.DESC ? field.getAscending().reversed() : field.getAscending();
    return hits.stream().sorted(comparator.thenComparing(DEFAULT)).collect(Collectors.toList());
  }

  public static List<Hit> filter(List<Hit> hits, HitFilter filter) {
    return hits.stream().filter(filter.toPredicate()).collect(Collectors.toList());
  }
}
