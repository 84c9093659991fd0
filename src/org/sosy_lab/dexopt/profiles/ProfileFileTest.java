// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;

public class ProfileFileTest {

  private static final String COLD_START =
      "interaction,appear#\n"
          + "ColdStart,120\n"
          + "name,profiled_srcblks_exprs\n"
          + "LFoo;.bar:()V,(1:100 g(0.5:50))\n"
          + "LFoo;.access$000:(LFoo;)I,(1:10)\n"
          + "LGone;.x:()V,(0:0)\n"
          + "\n"
          + "LFoo;.missing:()V,(0:0)\n"
          + "garbage,(1:1)\n";

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private DexNameTable names;
  private DexMethodRef bar;

  @Before
  public void setUp() {
    names = new DexNameTable();
    bar = names.makeMethod("LFoo;.bar:()V");
  }

  private ProfileFile index(String pContent) throws InvalidProfileFileException {
    return ProfileFile.index(
        Paths.get("profile.csv"),
        ByteBuffer.wrap(pContent.getBytes(StandardCharsets.UTF_8)),
        names);
  }

  private InvalidProfileFileException invalid(String pContent) {
    return assertThrows(InvalidProfileFileException.class, () -> index(pContent));
  }

  private Path write(String pName, String pContent) throws IOException {
    Path file = tmp.getRoot().toPath().resolve(pName);
    Files.write(file, pContent.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test
  public void keysAreResolved() throws InvalidProfileFileException {
    ProfileFile file = index(COLD_START);

    assertThat(file.getInteraction()).isEqualTo("ColdStart");
    assertThat(file.getAppearCount()).isEqualTo(120);
    assertThat(file.getNumMethods()).isEqualTo(1);
    assertThat(file.getProfile(bar)).isEqualTo("(1:100 g(0.5:50))");
    assertThat(file.getProfile(names.makeMethod("LFoo;.other:()V"))).isNull();
    assertThat(file.getAccessProfile(names.getType("LFoo;"), "access$000:(LFoo;)I"))
        .isEqualTo("(1:10)");
    assertThat(file.getAccessProfile(names.getType("LFoo;"), "access$001:(LFoo;)I")).isNull();
    assertThat(file.getUnresolvedKeys())
        .containsExactly("LFoo;.missing:()V", "LGone;.x:()V", "garbage")
        .inOrder();
  }

  @Test
  public void lastLineWithoutNewline() throws InvalidProfileFileException {
    ProfileFile file =
        index("interaction,appear#\nScroll,3\nname,profiled_srcblks_exprs\nLFoo;.bar:()V,(x)");

    assertThat(file.getProfile(bar)).isEqualTo("(x)");
  }

  @Test
  public void emptyProfile() throws InvalidProfileFileException {
    ProfileFile file = index("interaction,appear#\nScroll,0\nname,profiled_srcblks_exprs\n");

    assertThat(file.getNumMethods()).isEqualTo(0);
    assertThat(file.getUnresolvedKeys()).isEmpty();
  }

  @Test
  public void invalidHeaders() {
    assertThat(invalid("").getLine()).isEqualTo(1);
    assertThat(invalid("interaction,appear\n").getLine()).isEqualTo(1);
    assertThat(invalid("interaction,appear#\nColdStart\n").getLine()).isEqualTo(2);
    assertThat(invalid("interaction,appear#\nColdStart,many\n").getMessage())
        .contains("Invalid appearance count 'many'");
    assertThat(invalid("interaction,appear#\nColdStart,1\nname,values\n").getLine())
        .isEqualTo(3);
  }

  @Test
  public void lineWithoutComma() {
    InvalidProfileFileException e =
        invalid(
            "interaction,appear#\nColdStart,1\nname,profiled_srcblks_exprs\n"
                + "LFoo;.bar:()V,(1:1)\nLFoo;.baz:()V\n");

    assertThat(e.getLine()).isEqualTo(5);
    assertThat(e.getMessage()).contains("Missing ','");
  }

  @Test
  public void loadMappedFile() throws Exception {
    Path path = write("cold.csv", COLD_START);

    ProfileFile file = ProfileFile.load(path, names);

    assertThat(file.getPath().toString()).isEqualTo(path.toString());
    assertThat(file.getProfile(bar)).isEqualTo("(1:100 g(0.5:50))");
  }

  @Test
  public void loadAllKeepsOrder() throws Exception {
    Path scroll =
        write(
            "scroll.csv",
            "interaction,appear#\nScroll,7\nname,profiled_srcblks_exprs\nLFoo;.bar:()V,(0:0)\n");
    Path cold = write("cold.csv", COLD_START);

    ImmutableList<ProfileFile> files =
        ProfileFile.loadAll(ImmutableList.of(scroll, cold), names, 2);

    assertThat(files).hasSize(2);
    assertThat(files.get(0).getInteraction()).isEqualTo("Scroll");
    assertThat(files.get(1).getInteraction()).isEqualTo("ColdStart");
  }

  @Test
  public void loadAllPropagatesErrors() throws Exception {
    Path broken = write("broken.csv", "interaction\n");
    Path missing = tmp.getRoot().toPath().resolve("missing.csv");

    InvalidProfileFileException e =
        assertThrows(
            InvalidProfileFileException.class,
            () -> ProfileFile.loadAll(ImmutableList.of(broken, missing), names, 2));
    assertThat(e.getLine()).isEqualTo(1);
    assertThat(e).hasMessageThat().contains("interaction,appear#");
    assertThrows(
        IOException.class, () -> ProfileFile.loadAll(ImmutableList.of(missing), names, 1));
  }
}
