package com.containermgmt.querymonitor.normalizer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();

    @Test
    void replacesParameterListStringsAndDropsSemicolon() {
        String normalized = normalizer.normalize(
            "SELECT * FROM users WHERE id IN ($1, $2, $3) AND name = 'bob';");

        assertThat(normalized).isEqualTo("select * from users where id in (...) and name = '?'");
    }

    @Test
    void literalVariantsShareOneSignature() {
        String a = normalizer.normalize("SELECT * FROM orders WHERE customer_id = 42 AND status = 'open'");
        String b = normalizer.normalize("select *   from orders\n where customer_id = 7 and status = 'closed'");

        assertThat(a).isEqualTo("select * from orders where customer_id = ? and status = '?'");
        assertThat(b).isEqualTo(a);
        assertThat(normalizer.hash(a)).isEqualTo(normalizer.hash(b));
    }

    @Test
    void collapsesWhitespaceAndLowercases() {
        assertThat(normalizer.normalize("  SELECT\tName\n\nFROM   Users  ")).isEqualTo("select name from users");
    }

    @Test
    void replacesDecimalAndExponentNumbers() {
        assertThat(normalizer.normalize("select * from t where a = 3.14 and b > 1e10"))
            .isEqualTo("select * from t where a = ? and b > ?");
    }

    @Test
    void keepsDigitsInsideIdentifiers() {
        assertThat(normalizer.normalize("SELECT col1 FROM table2 WHERE x2 = 5"))
            .isEqualTo("select col1 from table2 where x2 = ?");
    }

    @Test
    void collapsesLiteralInLists() {
        assertThat(normalizer.normalize("select * from t where id in (1, 2, 3)"))
            .isEqualTo("select * from t where id in (...)");
        assertThat(normalizer.normalize("select * from t where code in ('a', 'b')"))
            .isEqualTo("select * from t where code in (...)");
    }

    @Test
    void parameterNumberDoesNotChangeTheSignature() {
        String first = normalizer.normalize("SELECT * FROM orders WHERE id = $1");
        String fifth = normalizer.normalize("SELECT * FROM orders WHERE id = $5");

        assertThat(first).isEqualTo(fifth).isEqualTo("select * from orders where id = $?");
        assertThat(normalizer.hash(first)).isEqualTo(normalizer.hash(fifth));
    }

    @Test
    void parameterListLengthDoesNotChangeTheSignature() {
        String three = normalizer.normalize("SELECT * FROM orders WHERE id IN ($1,$2,$3)");
        String two = normalizer.normalize("SELECT * FROM orders WHERE id IN ($9,$10)");

        assertThat(three).isEqualTo(two).isEqualTo("select * from orders where id in (...)");
        assertThat(normalizer.hash(three)).isEqualTo(normalizer.hash(two));
    }

    @Test
    void replacesRemainingPositionalParameters() {
        assertThat(normalizer.normalize("UPDATE t SET a = $1 WHERE id = $12"))
            .isEqualTo("update t set a = $? where id = $?");
    }

    @Test
    void handlesEscapedQuotesInStrings() {
        assertThat(normalizer.normalize("select * from people where name = 'O''Brien'"))
            .isEqualTo("select * from people where name = '?'");
    }

    @Test
    void nullNormalizesToEmptyString() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.hash(null)).isEqualTo(normalizer.hash(""));
    }

    @Test
    void secondPassMayStillChangeTheText() {
        String once = normalizer.normalize("select 1;;");
        String twice = normalizer.normalize(once);

        assertThat(once).isEqualTo("select ?;");
        assertThat(twice).isEqualTo("select ?");
    }

    @Test
    void hashIsMd5OfText() {
        assertThat(normalizer.hash("")).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
        assertThat(normalizer.hash("select ?")).hasSize(32).isEqualTo(normalizer.hash("select ?"));
        assertThat(normalizer.hash("select ?")).isNotEqualTo(normalizer.hash("select $?"));
    }

    @Test
    void signatureIsTruncatedNormalizedText() {
        String longQuery = "SELECT a, b, c, d, e, f, g, h FROM some_rather_long_table_name WHERE "
            + "first_column = 1 AND second_column = 'x' AND third_column = 3";

        String signature = normalizer.signature(longQuery, 80);

        assertThat(signature).hasSize(80);
        assertThat(normalizer.normalize(longQuery)).startsWith(signature);
        assertThat(normalizer.signature("SELECT 1", 80)).isEqualTo("select ?");
    }
}
