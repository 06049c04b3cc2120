package co.sqlgen.generators.java;

import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

public class JavaTypeNamesTest {

  @Test
  void shouldParsePrimitivesAndCommonNames() {
    assertThat(JavaTypeNames.parse("int")).contains(TypeName.INT);
    assertThat(JavaTypeNames.parse("String")).contains(ClassName.get(String.class));
    assertThat(JavaTypeNames.parse(" LocalDateTime ")).contains(ClassName.get(LocalDateTime.class));
  }

  @Test
  void shouldParseQualifiedNamesAndArrays() {
    assertThat(JavaTypeNames.parse("com.acme.Money")).contains(ClassName.get("com.acme", "Money"));
    assertThat(JavaTypeNames.parse("byte[]")).contains(ArrayTypeName.of(TypeName.BYTE));
    assertThat(JavaTypeNames.parse("String[][]"))
        .contains(ArrayTypeName.of(ArrayTypeName.of(ClassName.get(String.class))));
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"email-string", "text", "map<string,int>", "com.acme."})
  void shouldRejectTextThatIsNotAJavaType(String target) {
    assertThat(JavaTypeNames.parse(target)).isEmpty();
  }

  @Test
  void shouldBoxNullablePrimitives() {
    assertThat(JavaTypeNames.declaredType(TypeName.INT, true)).isEqualTo(ClassName.get(Integer.class));
    assertThat(JavaTypeNames.declaredType(TypeName.INT, false)).isEqualTo(TypeName.INT);
    assertThat(JavaTypeNames.declaredType(ClassName.get(String.class), true)).isEqualTo(ClassName.get(String.class));
  }
}
