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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.python.tree.BindingConflictException;
import com.google.python.tree.ModuleNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the names of many modules, several at a time. Module trees are independent, so each one
 * is handed to exactly one worker.
 *
 * <p>A binding conflict is reported as a {@link VariableResolver#BINDING_CONFLICT} error and stops
 * the processing of that module only. Any other exception means a broken tree and is rethrown.
 * Every run ends with a report from the error manager, which logs through this class's logger
 * unless another manager is given.
 */
public final class ModuleForestResolver {
  private static final Logger logger = Logger.getLogger(ModuleForestResolver.class.getName());

  private final AnalysisOptions options;
  private final ErrorManager errorManager;

  public ModuleForestResolver(AnalysisOptions options) {
    this(options, new LoggerErrorManager(logger));
  }

  public ModuleForestResolver(AnalysisOptions options, ErrorManager errorManager) {
    options.validate();
    this.options = options;
    this.errorManager = new ThreadSafeDelegatingErrorManager(errorManager);
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Resolves every module and returns the ones that resolved without error, in the given order.
   */
  public ImmutableList<ModuleNode> resolve(List<ModuleNode> modules) {
    try {
      return resolveAll(modules);
    } finally {
      errorManager.generateReport();
    }
  }

  private ImmutableList<ModuleNode> resolveAll(List<ModuleNode> modules) {
    int numThreads = options.getNumParallelModules();
    ThreadFactory threadFactory =
        r -> {
          Thread t = new Thread(r, "pyanalysis-ModuleForestResolver");
          t.setDaemon(true); // Do not prevent the JVM from exiting.
          return t;
        };
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            numThreads,
            numThreads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<Boolean>> futureList = new ArrayList<>(modules.size());
    for (ModuleNode module : modules) {
      futureList.add(executorService.submit(() -> resolveModule(module)));
    }
    poolExecutor.shutdown();

    List<Boolean> results;
    try {
      results = Futures.allAsList(futureList).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while resolving modules", e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    }

    ImmutableList.Builder<ModuleNode> resolved = ImmutableList.builder();
    for (int i = 0; i < modules.size(); i++) {
      if (results.get(i)) {
        resolved.add(modules.get(i));
      }
    }
    ImmutableList<ModuleNode> result = resolved.build();
    logger.log(
        result.size() == modules.size() ? Level.INFO : Level.WARNING,
        "Resolved {0} of {1} module(s)",
        new Object[] {result.size(), modules.size()});
    return result;
  }

  private boolean resolveModule(ModuleNode module) {
    logger.fine("Resolving " + module.getFullName());
    try {
      new VariableResolver().process(module);
    } catch (BindingConflictException e) {
      errorManager.report(
          CheckLevel.ERROR,
          PyError.make(
              e.getPosition(),
              VariableResolver.BINDING_CONFLICT,
              e.getVariableName(),
              e.getScope().getDescription()));
      return false;
    }
    if (options.shouldCheckTreeIntegrity()) {
      new TreeValidator(true).process(module);
    }
    if (options.shouldPrintTree()) {
      logger.info(module.toStringTree());
    }
    return true;
  }
}
