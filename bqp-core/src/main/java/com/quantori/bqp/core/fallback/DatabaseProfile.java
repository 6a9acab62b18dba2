package com.quantori.bqp.core.fallback;

import java.util.List;
import java.util.Locale;
import java.util.Random;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** What synthesized hits of a well-known public database look like. */
@Getter
@AllArgsConstructor
enum DatabaseProfile {
  NT(
      "Nucleotide collection",
      false,
      67_823_451L,
      542_696_987_123L,
      List.of(
          "Escherichia coli",
          "Homo sapiens",
          "Mus musculus",
          "Saccharomyces cerevisiae",
          "Arabidopsis thaliana")),
  NR(
      "Non-redundant protein sequences",
      true,
      434_544_773L,
      159_064_915_452L,
      List.of(
          "Escherichia coli str. K-12",
          "Homo sapiens",
          "Mus musculus",
          "Rattus norvegicus",
          "Drosophila melanogaster")),
  REFSEQ_RNA(
      "RefSeq RNA sequences",
      false,
      18_567_234L,
      23_445_678_901L,
      List.of(
          "Homo sapiens",
          "Mus musculus",
          "Rattus norvegicus",
          "Danio rerio",
          "Caenorhabditis elegans")),
  REFSEQ_GENOMIC(
      "RefSeq Genome sequences",
      false,
      234_567L,
      876_543_210_987L,
      List.of(
          "Escherichia coli",
          "Bacillus subtilis",
          "Pseudomonas aeruginosa",
          "Staphylococcus aureus")),
  SWISSPROT(
      "UniProtKB/Swiss-Prot",
      true,
      568_002L,
      204_840_472L,
      List.of("Homo sapiens", "Mus musculus", "Escherichia coli", "Saccharomyces cerevisiae")),
  PDB(
      "Protein Data Bank proteins",
      true,
      789_456L,
      234_567_890L,
      List.of(
          "Homo sapiens",
          "Escherichia coli",
          "Thermus thermophilus",
          "Bacillus stearothermophilus")),
  OTHER("Custom database", false, 1_000_000L, 1_000_000_000L, List.of("Unknown organism"));

  private final String title;
  private final boolean protein;
  private final long sequenceCount;
  private final long letterCount;
  private final List<String> organisms;

  static DatabaseProfile of(String database) {
    if (database == null) {
      return OTHER;
    }
    try {
      return valueOf(database.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      // custom and unknown databases share one profile
      return OTHER;
    }
  }

  String accession(Random random, int index) {
    switch (this) {
      case NT:
        return refSeq(random, "NC", "NT", "NW");
      case NR:
        return refSeq(random, "NP", "YP", "WP", "XP");
      case REFSEQ_RNA:
        return refSeq(random, "NM", "NR", "XM", "XR");
      case REFSEQ_GENOMIC:
        return refSeq(random, "NC", "NZ");
      case SWISSPROT:
        return pick(random, "P", "Q", "O") + String.format("%05d", random.nextInt(99_999));
      case PDB:
        String id = Integer.toString(1000 + random.nextInt(45_000), 36).toUpperCase(Locale.ROOT);
        return id + "_" + pick(random, "A", "B", "C");
      default:
        return String.format("ACC_%06d", index);
    }
  }

  private static String refSeq(Random random, String... prefixes) {
    return String.format(
        "%s_%06d.%d", pick(random, prefixes), random.nextInt(999_999), random.nextInt(9) + 1);
  }

  private static String pick(Random random, String... values) {
    return values[random.nextInt(values.length)];
  }
}
