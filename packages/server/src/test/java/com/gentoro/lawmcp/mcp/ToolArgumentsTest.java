package com.gentoro.lawmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lawmcp.exception.ValidationException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

  @Test
  void stringsAreTrimmedAndBlankMeansAbsent() {
    ToolArguments args = new ToolArguments(Map.of("name", "  民法 ", "pcode", "   "));

    assertEquals("民法", args.requiredString("name"));
    assertNull(args.optionalString("pcode"));
    assertThrows(ValidationException.class, () -> args.requiredString("pcode"));
  }

  @Test
  void integersAcceptNumbersAndNumericStrings() {
    ToolArguments args =
        new ToolArguments(Map.of("a", 5, "b", 7.0, "c", " 9 ", "d", 1.5, "e", "many"));

    assertEquals(5, args.optionalInt("a"));
    assertEquals(7, args.optionalInt("b"));
    assertEquals(9, args.optionalInt("c"));
    assertNull(args.optionalInt("missing"));
    assertThrows(ValidationException.class, () -> args.optionalInt("d"));
    assertThrows(ValidationException.class, () -> args.optionalInt("e"));
  }

  @Test
  void booleans() {
    ToolArguments args = new ToolArguments(Map.of("a", true, "b", "FALSE", "c", "yes"));

    assertTrue(args.optionalBoolean("a"));
    assertFalse(args.optionalBoolean("b"));
    assertThrows(ValidationException.class, () -> args.optionalBoolean("c"));
  }

  @Test
  void nullArgumentsAreEmpty() {
    assertNull(new ToolArguments(null).optionalString("x"));
  }
}
