/**
 * Command side: commands, handlers and the command bus.
 */
package ledger.command;
