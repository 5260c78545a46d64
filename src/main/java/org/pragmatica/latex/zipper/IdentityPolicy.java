package org.pragmatica.latex.zipper;

/**
 * What identity an ancestor gets when a zipper rebuilds it on the way up.
 */
public enum IdentityPolicy {
    /**
     * Rebuilt ancestors keep the identity they had when the zipper descended through them.
     */
    PRESERVE,
    /**
     * Every rebuilt ancestor gets a newly minted identity.
     */
    FRESH
}
