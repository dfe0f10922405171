/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.python.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.python.tree.ModuleNode;
import com.google.python.tree.PackageNode;
import com.google.python.tree.SourcePosition;
import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * All modules of a program, keyed by their dotted name.
 *
 * <p>This is the only structure shared between module trees. It may be used from several threads;
 * the trees it holds may not.
 */
public final class ModuleRegistry {
  private static final Logger logger = Logger.getLogger(ModuleRegistry.class.getName());

  private final ConcurrentMap<String, ModuleNode> modules = new ConcurrentHashMap<>();

  /** Creates and registers a module for a dotted name such as {@code "os.path"}. */
  public ModuleNode createModule(String fullName, String filename) {
    return register(
        new ModuleNode(
            getName(fullName), getPackageName(fullName), SourcePosition.of(filename, 1)));
  }

  /** Creates and registers the module of a package. */
  public PackageNode createPackage(String fullName, String filename) {
    return (PackageNode)
        register(
            new PackageNode(
                getName(fullName), getPackageName(fullName), SourcePosition.of(filename, 1)));
  }

  /**
   * Registers a module built elsewhere.
   *
   * @throws IllegalArgumentException if a module of that name is already registered
   */
  public ModuleNode register(ModuleNode module) {
    ModuleNode previous = modules.putIfAbsent(module.getFullName(), module);
    checkArgument(previous == null, "Module %s registered twice", module.getFullName());
    logger.fine("Registered " + module.getFullName() + " from " + module.getFilename());
    return module;
  }

  public @Nullable ModuleNode getModule(String fullName) {
    return modules.get(fullName);
  }

  public boolean hasModule(String fullName) {
    return modules.containsKey(fullName);
  }

  /** Returns the package a module belongs to, if that package is registered. */
  public @Nullable PackageNode getPackage(ModuleNode module) {
    String packageName = module.getPackageName();
    if (packageName == null) {
      return null;
    }
    ModuleNode result = modules.get(packageName);
    return result instanceof PackageNode ? (PackageNode) result : null;
  }

  /** Returns every registered module, sorted by dotted name. */
  public ImmutableList<ModuleNode> getModules() {
    return ImmutableList.sortedCopyOf(
        Comparator.comparing(ModuleNode::getFullName), modules.values());
  }

  private static String getName(String fullName) {
    checkArgument(
        !fullName.isEmpty() && !fullName.startsWith(".") && !fullName.endsWith("."),
        "Bad module name '%s'",
        fullName);
    return fullName.substring(fullName.lastIndexOf('.') + 1);
  }

  private static @Nullable String getPackageName(String fullName) {
    int dot = fullName.lastIndexOf('.');
    return dot < 0 ? null : fullName.substring(0, dot);
  }
}
