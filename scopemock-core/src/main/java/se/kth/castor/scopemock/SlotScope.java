package se.kth.castor.scopemock;

import se.kth.castor.scopemock.context.ExecutionContext;

/**
 * Decides which callers share an override stack.
 */
public enum SlotScope {
  /**
   * One stack per execution context, see {@link ExecutionContext#current()}. An override installed
   * on one thread is invisible to every other thread.
   */
  THREAD {
    @Override
    Object contextKey() {
      return ExecutionContext.current();
    }
  },
  /**
   * One stack for the whole process. Overrides leak into concurrently running tests that call the
   * same target.
   */
  GLOBAL {
    @Override
    Object contextKey() {
      return ExecutionContext.shared();
    }
  };

  abstract Object contextKey();
}
