package co.sqlgen.core.typemap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads type mapping rules from a JSON array. Rules are returned in file order, which
 * is the order that breaks specificity ties.
 */
public final class TypeRuleLoader {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<List<TypeMappingRule>> RULES = new TypeReference<>() {};

  private TypeRuleLoader() {}

  public static List<TypeMappingRule> load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    return List.copyOf(JSON.readValue(bytes, RULES));
  }

  public static List<TypeMappingRule> load(InputStream in) throws IOException {
    return List.copyOf(JSON.readValue(in, RULES));
  }
}
