/**
 * memobank source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.memobank.runtime.MemoProject} registers collections and answers fetch and status queries.</li>
 *   <li>{@code io.memobank.runtime.FetchOrchestrator} decides cache hit versus computation and runs it.</li>
 *   <li>{@code io.memobank.storage.ResourceStore} is the authoritative on-disk state of every resource.</li>
 *   <li>{@code io.memobank.storage.SqliteStatusIndex} accelerates status scans and is reconciled from disk.</li>
 *   <li>{@code io.memobank.Main} bootstraps the CLI process.</li>
 * </ul>
 */
package io.memobank;
