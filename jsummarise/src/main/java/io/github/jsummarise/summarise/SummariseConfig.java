package io.github.jsummarise.summarise;

import io.github.jsummarise.util.EnvUtil;

public class SummariseConfig {
    public static final String RENAME_MULTI_COLUMN = "jsummarise.rename.multi-column";
    public static final String GROUP_SORT = "jsummarise.group.sort";
    public static final String GROUP_DROPNA = "jsummarise.group.dropna";

    private final RenamePolicy renamePolicy;
    private final boolean groupSort;
    private final boolean groupDropna;

    public SummariseConfig(RenamePolicy renamePolicy, boolean groupSort, boolean groupDropna) {
        this.renamePolicy = renamePolicy;
        this.groupSort = groupSort;
        this.groupDropna = groupDropna;
    }

    public static SummariseConfig defaults() {
        return new SummariseConfig(RenamePolicy.IGNORE, true, true);
    }

    /**
     * settings from jsummarise.properties and system properties, see {@link EnvUtil}
     */
    public static SummariseConfig fromEnv() {
        return new SummariseConfig(
                RenamePolicy.of(EnvUtil.getEnvProperty(RENAME_MULTI_COLUMN, "ignore")),
                Boolean.parseBoolean(EnvUtil.getEnvProperty(GROUP_SORT, "true")),
                Boolean.parseBoolean(EnvUtil.getEnvProperty(GROUP_DROPNA, "true")));
    }

    public SummariseConfig withRenamePolicy(RenamePolicy renamePolicy) {
        return new SummariseConfig(renamePolicy, groupSort, groupDropna);
    }

    public RenamePolicy getRenamePolicy() {
        return renamePolicy;
    }

    public boolean isGroupSort() {
        return groupSort;
    }

    public boolean isGroupDropna() {
        return groupDropna;
    }

    @Override
    public String toString() {
        return "SummariseConfig{renamePolicy=" + renamePolicy + ", groupSort=" + groupSort + ", groupDropna=" + groupDropna + "}";
    }
}
