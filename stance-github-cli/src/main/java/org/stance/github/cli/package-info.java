/**
 * Command line report over organizations, repositories and issues.
 */
@NullMarked
package org.stance.github.cli;

import org.jspecify.annotations.NullMarked;
