package com.secrecon.jdbc.calcite;

import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} for model files. The operand names the dataset directory under
 * {@code dataset} and may carry engine options under their {@code secrecon.*} keys.
 */
public final class SecReconSchemaFactory implements SchemaFactory {

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        return new SecReconSchema(parentSchema, name, operand);
    }
}
