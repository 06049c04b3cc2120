package co.sqlgen.generators.java.model;

/**
 * A value-set column that is neither the value nor the display name, with the accessor
 * name it is exposed under.
 */
public record ValueSetAttribute(String column, String accessor) {}
