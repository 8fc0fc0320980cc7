/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.junit.Test;

public class FieldTest {

    @Test
    public void shouldKeepSettingsAcrossCopies() {
        Field field = Field.create("max.table.sync.workers")
                .withDescription("a description")
                .withType(Type.INT)
                .withDefault(3)
                .withImportance(Importance.HIGH)
                .required();

        assertThat(field.description()).isEqualTo("a description");
        assertThat(field.type()).isEqualTo(Type.INT);
        assertThat(field.defaultValueAsString()).isEqualTo("3");
        assertThat(field.importance()).isEqualTo(Importance.HIGH);
        assertThat(field.isRequired()).isTrue();
        assertThat(field).isEqualTo(Field.create("max.table.sync.workers"));
    }

    @Test
    public void shouldCheckTypeBeforeRange() {
        Field field = Field.create("workers").withType(Type.INT).withValidation(Field.UNSIGNED_SHORT);

        assertThat(problems(field, "4")).isEmpty();
        assertThat(problems(field, " 65535 ")).isEmpty();
        assertThat(problems(field, "65536")).containsExactly("An unsigned 16-bit integer is expected");
        assertThat(problems(field, "-1")).containsExactly("An unsigned 16-bit integer is expected");
        assertThat(problems(field, "four")).containsExactly("An integer is expected");
    }

    @Test
    public void shouldCheckUnsignedIntRange() {
        Field field = Field.create("attempts").withType(Type.LONG).withValidation(Field.UNSIGNED_INT);

        assertThat(problems(field, "0")).isEmpty();
        assertThat(problems(field, "4294967295")).isEmpty();
        assertThat(problems(field, "4294967296")).containsExactly("An unsigned 32-bit integer is expected");
    }

    @Test
    public void shouldCheckUnsignedLongRange() {
        Field field = Field.create("id").withValidation(Field.UNSIGNED_LONG);

        assertThat(problems(field, "18446744073709551615")).isEmpty();
        assertThat(problems(field, "18446744073709551616")).isNotEmpty();
        assertThat(problems(field, "-5")).isNotEmpty();
        assertThat(problems(field, "")).isNotEmpty();
    }

    @Test
    public void shouldRejectNegativeNumbers() {
        Field field = Field.create("delay").withType(Type.LONG).withValidation(Field.NON_NEGATIVE);

        assertThat(problems(field, "0")).isEmpty();
        assertThat(problems(field, "-1")).containsExactly("A non-negative number is expected");
    }

    @Test
    public void shouldAcceptMissingOptionalValue() {
        Field field = Field.create("id").withType(Type.LONG).withValidation(Field.UNSIGNED_LONG);
        assertThat(field.validate(Configuration.create().build())).isEmpty();
    }

    @Test
    public void shouldRequireNonBlankValue() {
        Field field = Field.create("publication").required();

        assertThat(field.validate(Configuration.create().build())).containsExactly("A value is required");
        assertThat(problems(field, "  ")).containsExactly("A value is required");
        assertThat(problems(field, "orders_pub")).isEmpty();
    }

    @Test
    public void shouldValidateBooleans() {
        Field field = Field.create("flag").withType(Type.BOOLEAN);

        assertThat(problems(field, "TRUE")).isEmpty();
        assertThat(problems(field, "yes")).containsExactly("Either 'true' or 'false' is expected");
    }

    @Test
    public void shouldNotShowPasswordInProblem() {
        Field field = Field.create("pg.password").withType(Type.PASSWORD);
        assertThat(field.describe("hunter2", "too short")).isEqualTo("The 'pg.password' value ******** is invalid: too short");
    }

    @Test
    public void shouldDefineFieldsInConfigDef() {
        Field first = Field.create("first").withType(Type.INT).withDefault(1).withDescription("first");
        Field second = Field.create("second").withDescription("second");
        ConfigDef def = Field.group(new ConfigDef(), "Group", first, second);

        assertThat(def.names()).containsOnly("first", "second");
        assertThat(def.configKeys().get("first").orderInGroup).isEqualTo(1);
        assertThat(def.configKeys().get("second").orderInGroup).isEqualTo(2);
        assertThat(def.configKeys().get("first").group).isEqualTo("Group");
    }

    @Test
    public void shouldKeepOrderInSets() {
        Field.Set set = Field.setOf(Field.create("z"), Field.create("a"), Field.create("m"));

        assertThat(set.names()).containsExactly("z", "a", "m");
        assertThat(set.fieldWithName("a")).isNotNull();
        assertThat(set.fieldWithName("b")).isNull();
    }

    private static List<String> problems(Field field, String value) {
        return field.validate(Configuration.create().with(field, value).build());
    }
}
