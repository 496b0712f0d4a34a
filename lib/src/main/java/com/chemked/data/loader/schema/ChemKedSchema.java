package com.chemked.data.loader.schema;

import com.chemked.data.loader.LoaderException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** A compiled ChemKED schema: the root mapping schema plus the custom rule names it uses. */
public final class ChemKedSchema {

    public static final String RESOURCE_DIRECTORY = "com/chemked/data/schema";
    public static final String ROOT_FILE = "chemked_schema.yaml";

    private static volatile ChemKedSchema bundled;

    private final FieldSchema root;
    private final Set<String> ruleNames;

    ChemKedSchema(FieldSchema root) {
        this.root = Objects.requireNonNull(root, "root");
        this.ruleNames = Collections.unmodifiableSet(collectRuleNames(root));
    }

    /**
     * The schema shipped with the library, loaded once per class loader.
     *
     * @throws IllegalStateException if the packaged schema files are missing or malformed
     */
    public static ChemKedSchema bundled() {
        ChemKedSchema schema = bundled;
        if (schema == null) {
            synchronized (ChemKedSchema.class) {
                schema = bundled;
                if (schema == null) {
                    try {
                        schema =
                                SchemaLoader.classpath(ChemKedSchema.class.getClassLoader(), RESOURCE_DIRECTORY)
                                        .load(ROOT_FILE);
                    } catch (LoaderException ex) {
                        throw new IllegalStateException("Bundled ChemKED schema is unusable", ex);
                    }
                    bundled = schema;
                }
            }
        }
        return schema;
    }

    public FieldSchema getRoot() {
        return root;
    }

    /** Every custom rule name referenced anywhere in the schema. */
    public Set<String> getRuleNames() {
        return ruleNames;
    }

    private static Set<String> collectRuleNames(FieldSchema root) {
        Set<String> names = new LinkedHashSet<>();
        Set<FieldSchema> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<FieldSchema> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            FieldSchema schema = pending.pop();
            if (!seen.add(schema)) {
                continue;
            }
            names.addAll(schema.getRules());
            schema.getFields().map(Map::values).ifPresent(pending::addAll);
            schema.getItemSchema().ifPresent(pending::push);
            schema.getItems().ifPresent(pending::addAll);
            pending.addAll(schema.getAnyOf());
        }
        return names;
    }
}
