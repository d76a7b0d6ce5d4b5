package com.gentoro.llmc.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.CommandNode;
import com.gentoro.llmc.ast.ErrorNode;
import com.gentoro.llmc.ast.ErrorSeverity;
import com.gentoro.llmc.ast.FileReferenceNode;
import com.gentoro.llmc.ast.FileReferenceType;
import com.gentoro.llmc.ast.QuestionNode;
import com.gentoro.llmc.ast.QuestionType;
import com.gentoro.llmc.ast.TextFormat;
import java.util.List;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SemanticElementExtractorTest {

  private static QuestionType typeOf(String text) {
    List<QuestionNode> questions = SemanticElementExtractor.questions(text, UnaryOperator.identity());
    assertEquals(1, questions.size(), () -> "expected one question in: " + text);
    return questions.get(0).type();
  }

  @Test
  @DisplayName("file references carry the intent of their clause")
  void fileReferences() {
    List<FileReferenceNode> refs =
        SemanticElementExtractor.fileReferences(
            "Please create src/main/App.java and read ./README.md:12", UnaryOperator.identity());
    assertEquals(2, refs.size());
    assertEquals("src/main/App.java", refs.get(0).path());
    assertEquals(FileReferenceType.CREATE, refs.get(0).referenceType());
    assertFalse(refs.get(0).absolute());
    assertEquals("./README.md", refs.get(1).path());
    assertEquals(FileReferenceType.READ, refs.get(1).referenceType());
    assertEquals(":12", refs.get(1).lineReference());
  }

  @Test
  @DisplayName("a trailing sentence period is not part of the path")
  void trailingPeriod() {
    FileReferenceNode ref =
        SemanticElementExtractor.fileReferences("Delete /tmp/cache.", UnaryOperator.identity())
            .get(0);
    assertEquals("/tmp/cache", ref.path());
    assertEquals(FileReferenceType.DELETE, ref.referenceType());
    assertTrue(ref.absolute());
  }

  @Test
  @DisplayName("question types follow their wording")
  void questionTypes() {
    assertEquals(QuestionType.MULTIPLE_CHOICE, typeOf("Which option do you prefer?"));
    assertEquals(QuestionType.CLARIFICATION, typeOf("What do you mean by that?"));
    assertEquals(QuestionType.YES_NO, typeOf("Are you sure?"));
    assertEquals(QuestionType.OPEN_ENDED, typeOf("What should the file be called?"));
  }

  @Test
  @DisplayName("shell prompts become commands")
  void commands() {
    List<CommandNode> commands =
        SemanticElementExtractor.commands("Run:\n$ git status\n  $ ls -la  ", UnaryOperator.identity());
    assertEquals(List.of("git status", "ls -la"), commands.stream().map(CommandNode::command).toList());
  }

  @Test
  @DisplayName("model-reported errors keep their severity")
  void modelErrors() {
    List<ErrorNode> errors =
        SemanticElementExtractor.modelErrors(
            "Error: file not found\nFatal: disk full", UnaryOperator.identity());
    assertEquals(2, errors.size());
    assertEquals("file not found", errors.get(0).message());
    assertEquals(ErrorSeverity.ERROR, errors.get(0).severity());
    assertEquals("disk full", errors.get(1).message());
    assertEquals(ErrorSeverity.CRITICAL, errors.get(1).severity());
  }

  @Test
  @DisplayName("text format is detected from its shape")
  void detectFormat() {
    assertEquals(TextFormat.JSON, SemanticElementExtractor.detectFormat(" {\"a\": 1} "));
    assertEquals(TextFormat.JSON, SemanticElementExtractor.detectFormat("[1, 2]"));
    assertEquals(TextFormat.MARKDOWN, SemanticElementExtractor.detectFormat("Use **bold** here"));
    assertEquals(TextFormat.PLAIN, SemanticElementExtractor.detectFormat("Just words."));
  }
}
