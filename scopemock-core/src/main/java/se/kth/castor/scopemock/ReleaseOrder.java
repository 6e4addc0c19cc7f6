package se.kth.castor.scopemock;

public enum ReleaseOrder {
  /**
   * Guards may be released in any order; each release removes exactly the override it installed.
   */
  ANY,
  /**
   * Guards must be released in reverse install order. A violation still removes the override and
   * then fails with {@link MockException.Type#OUT_OF_ORDER_RELEASE}.
   */
  STRICT
}
