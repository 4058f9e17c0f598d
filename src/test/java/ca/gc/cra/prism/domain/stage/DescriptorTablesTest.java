package ca.gc.cra.prism.domain.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DescriptorTablesTest {

  @Test
  void perspectivesCoverEveryBinaryCode() {
    assertEquals(Perspective.WIDTH, Perspective.values().length);
    Set<String> codes = new HashSet<>();
    for (Perspective perspective : Perspective.values()) {
      codes.add(perspective.binaryCode());
      assertEquals(Integer.parseInt(perspective.binaryCode(), 2), perspective.index());
    }
    assertEquals(8, codes.size());
  }

  @Test
  void temporalScopesFormRowMajorGrid() {
    assertEquals(TemporalScope.WIDTH, TemporalScope.values().length);
    for (TemporalScope cell : TemporalScope.values()) {
      assertEquals(cell.index(), cell.row() * 3 + cell.column());
    }
    assertEquals("Present-Relational", TemporalScope.PRESENT_RELATIONAL.displayName());
    assertEquals(1, TemporalScope.PRESENT_RELATIONAL.row());
    assertEquals(2, TemporalScope.PRESENT_RELATIONAL.column());
  }
}
