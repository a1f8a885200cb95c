package io.poseflow.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"frames=./in", "-h", "--Sequential", " ", "cache.capacity=8", "-v"});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--sequential"));
    assertArrayEquals(new String[] {"frames=./in", "cache.capacity=8"}, input.keyValueArgs());
  }

  @Test
  void emptyArgumentsHaveNoFlags() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.verbose());
    assertFalse(input.hasFlag(null));
    assertArrayEquals(new String[0], input.keyValueArgs());
  }

  @Test
  void dashedKeyValueIsNotAFlag() {
    CliInput input = CliInput.parse(new String[] {"-x=1"});

    assertFalse(input.hasFlag("-x=1"));
    assertArrayEquals(new String[] {"-x=1"}, input.keyValueArgs());
  }
}
