package com.polygen.core.ir;

/**
 * Interpreted effects of table annotations.
 *
 * @param taggable {@code @taggable}
 * @param linkRows {@code @link_rows}, or null
 * @param load {@code @load}, or null
 * @param save {@code @save}, or null
 * @param cacheStrategy {@code @cache} strategy, or null
 * @param readonly {@code @readonly}
 * @param softDeleteField {@code @soft_delete} field, or null
 * @param renamedFrom {@code @renamed_from} previous name, or null
 * @param datasource {@code @datasource} name, inherited from the namespace when absent
 * @param output {@code @output} path hint, or null
 */
public record TableOptions(
    boolean taggable,
    LinkRows linkRows,
    DataSourceSpec load,
    DataSourceSpec save,
    String cacheStrategy,
    boolean readonly,
    String softDeleteField,
    String renamedFrom,
    String datasource,
    String output
) {
    public static TableOptions none() {
        return new TableOptions(false, null, null, null, null, false, null, null, null, null);
    }
}
