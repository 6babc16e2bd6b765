/*
 * Copyright 2016 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.tsprinter.emit;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.tsprinter.ast.GeneratedNameKind;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.SyntaxKind;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Picks the text of generated identifiers. Every name is unique within the file being printed:
 * it is not a global of the program, not an identifier of the file and not a name generated
 * earlier in the same pass.
 */
final class GeneratedNameResolver {

  /** The low bits of the temp flags word count the {@code _a, _b, ...} names handed out. */
  @VisibleForTesting static final int TEMP_FLAGS_AUTO = 0x00000000;

  @VisibleForTesting static final int TEMP_FLAGS_COUNT_MASK = 0x0FFFFFFF;

  /** Set once {@code _i} has been used in the current temp scope. */
  @VisibleForTesting static final int TEMP_FLAGS_I = 0x10000000;

  /** Set once {@code _n} has been used in the current temp scope. */
  @VisibleForTesting static final int TEMP_FLAGS_N = 0x20000000;

  private static final CharMatcher NON_WORD =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .negate();

  private final PrintSession session;
  private final EmitResolver resolver;

  GeneratedNameResolver(PrintSession session, EmitResolver resolver) {
    this.session = checkNotNull(session);
    this.resolver = checkNotNull(resolver);
  }

  /** Returns the text of a generated identifier, the same text on every call within a pass. */
  String getGeneratedName(Node name) {
    checkState(name.isGeneratedIdentifier(), "Not a generated identifier: %s", name);
    if (name.getAutoGenerateKind() == GeneratedNameKind.NODE) {
      Node source = getSourceNodeForGeneratedName(name);
      Map<Node, String> memo = session.getNodeGeneratedNames();
      String text = memo.get(source);
      if (text == null) {
        text = unescapeIdentifier(generateNameForNode(source));
        memo.put(source, text);
      }
      return text;
    }
    Map<Node, String> memo = session.getGeneratedNames();
    String text = memo.get(name);
    if (text == null) {
      text = unescapeIdentifier(makeName(name));
      memo.put(name, text);
    }
    return text;
  }

  private String makeName(Node name) {
    switch (name.getAutoGenerateKind()) {
      case AUTO:
        return makeTempVariableName(TEMP_FLAGS_AUTO);
      case LOOP:
        return makeTempVariableName(TEMP_FLAGS_I);
      case UNIQUE:
        return makeUniqueName(checkNotNull(name.getText()));
      default:
        throw new IllegalStateException("Unexpected name kind: " + name.getAutoGenerateKind());
    }
  }

  /**
   * Follows the original chain of a node-derived name to the node the name stands for. The walk
   * stops early at another node-derived name.
   */
  private static Node getSourceNodeForGeneratedName(Node name) {
    Node node = name;
    while (node.getOriginal() != null) {
      node = node.getOriginal();
      if (node.isKind(SyntaxKind.IDENTIFIER)
          && node.getAutoGenerateKind() == GeneratedNameKind.NODE
          && node != name) {
        break;
      }
    }
    return node;
  }

  private String generateNameForNode(Node node) {
    switch (node.getKind()) {
      case IDENTIFIER:
        if (node.isGeneratedIdentifier()) {
          return node == getSourceNodeForGeneratedName(node)
                  && node.getAutoGenerateKind() == GeneratedNameKind.NODE
              ? makeTempVariableName(TEMP_FLAGS_AUTO)
              : makeUniqueName(getGeneratedName(node));
        }
        return makeUniqueName(getIdentifierText(node));
      case MODULE_DECLARATION:
      case ENUM_DECLARATION:
        return generateNameForModuleOrEnum(node);
      case IMPORT_DECLARATION:
      case EXPORT_DECLARATION:
        return generateNameForImportOrExportDeclaration(node);
      case FUNCTION_DECLARATION:
      case CLASS_DECLARATION:
      case EXPORT_ASSIGNMENT:
        return makeUniqueName("default");
      case CLASS_EXPRESSION:
        return makeUniqueName("class");
      default:
        return makeTempVariableName(TEMP_FLAGS_AUTO);
    }
  }

  private String generateNameForModuleOrEnum(Node node) {
    String name = getIdentifierText(checkNotNull(node.getChild(Node.Slot.NAME)));
    return isUniqueLocalName(name, node) ? name : makeUniqueName(name);
  }

  private String generateNameForImportOrExportDeclaration(Node node) {
    Node specifier = node.getChild(Node.Slot.MODULE_SPECIFIER);
    String baseName =
        specifier != null && specifier.isKind(SyntaxKind.STRING_LITERAL)
            ? makeIdentifierFromModuleName(checkNotNull(specifier.getText()))
            : "module";
    return makeUniqueName(baseName);
  }

  /** Whether no container inside {@code container}, itself included, declares {@code name}. */
  private static boolean isUniqueLocalName(String name, Node container) {
    if (container.getLocals().contains(name)) {
      return false;
    }
    for (Node child : container.getChildNodes()) {
      if (!isUniqueLocalName(name, child)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the next free name of the {@code _a ... _z, _0, _1, ...} sequence. {@code _i} and
   * {@code _n} are left out of the sequence. With {@code flags} of {@link #TEMP_FLAGS_I}, the
   * name {@code _i} is tried first, then {@code _n}, each once per temp scope.
   */
  @VisibleForTesting
  String makeTempVariableName(int flags) {
    if (flags == TEMP_FLAGS_I) {
      String name = tryReservedTempName(TEMP_FLAGS_I, "_i");
      if (name == null) {
        name = tryReservedTempName(TEMP_FLAGS_N, "_n");
      }
      if (name != null) {
        return name;
      }
    } else if (flags == TEMP_FLAGS_N) {
      String name = tryReservedTempName(TEMP_FLAGS_N, "_n");
      if (name != null) {
        return name;
      }
    }
    while (true) {
      int tempFlags = session.getTempFlags();
      int count = tempFlags & TEMP_FLAGS_COUNT_MASK;
      session.setTempFlags(tempFlags + 1);
      // Skip over 'i' and 'n'
      if (count != 8 && count != 13) {
        String name = count < 26 ? "_" + (char) ('a' + count) : "_" + (count - 26);
        if (isUniqueName(name)) {
          session.addGeneratedName(name);
          return name;
        }
      }
    }
  }

  private @Nullable String tryReservedTempName(int flag, String name) {
    int tempFlags = session.getTempFlags();
    if ((tempFlags & flag) == 0) {
      session.setTempFlags(tempFlags | flag);
      if (isUniqueName(name)) {
        session.addGeneratedName(name);
        return name;
      }
    }
    return null;
  }

  /** Returns {@code baseName} plus an underscore, if missing, plus the first free number. */
  @VisibleForTesting
  String makeUniqueName(String baseName) {
    if (!baseName.endsWith("_")) {
      baseName += "_";
    }
    for (int i = 1; ; i++) {
      String generatedName = baseName + i;
      if (isUniqueName(generatedName)) {
        session.addGeneratedName(generatedName);
        return generatedName;
      }
    }
  }

  private boolean isUniqueName(String name) {
    return !resolver.hasGlobalName(name)
        && !session.getSourceFile().getIdentifiers().contains(name)
        && !session.isGeneratedName(name);
  }

  private static String getIdentifierText(Node identifier) {
    if (identifier.isSynthesized() || identifier.getParent() == null) {
      return unescapeIdentifier(checkNotNull(identifier.getText()));
    }
    return NodeUtil.getSourceTextOfNode(identifier);
  }

  /**
   * Makes an identifier from the base name of a module path: a leading digit gets an underscore in
   * front, and every character that cannot appear in an identifier becomes an underscore.
   */
  static String makeIdentifierFromModuleName(String moduleName) {
    String baseName = CharMatcher.is('/').trimTrailingFrom(moduleName);
    baseName = baseName.substring(baseName.lastIndexOf('/') + 1);
    if (!baseName.isEmpty() && CharMatcher.inRange('0', '9').matches(baseName.charAt(0))) {
      baseName = "_" + baseName;
    }
    return NON_WORD.replaceFrom(baseName, '_');
  }

  /** Adds an underscore to names that start with two, so they cannot clash with built-ins. */
  static String escapeIdentifier(String identifier) {
    return identifier.startsWith("__") ? "_" + identifier : identifier;
  }

  /** Reverses {@link #escapeIdentifier}. */
  static String unescapeIdentifier(String identifier) {
    return identifier.startsWith("___") ? identifier.substring(1) : identifier;
  }
}
