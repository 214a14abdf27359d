package com.tenframework.runtime.message;

import lombok.Getter;

/**
 * 命令结果。isFinal=false 表示同一命令后续还会有流式结果。
 */
@Getter
public class CommandResult extends Message {

    private long inResponseTo;

    private StatusCode statusCode;

    private boolean isFinal = true;

    private String detail;

    public CommandResult(StatusCode statusCode, long inResponseTo, String originalCommandName) {
        super(originalCommandName);
        this.statusCode = statusCode;
        this.inResponseTo = inResponseTo;
    }

    protected CommandResult(CommandResult other, boolean keepId) {
        super(other, keepId);
        this.inResponseTo = other.inResponseTo;
        this.statusCode = other.statusCode;
        this.isFinal = other.isFinal;
        this.detail = other.detail;
    }

    public static CommandResult create(StatusCode statusCode, Command command) {
        return new CommandResult(statusCode, command.getCommandId(), command.getName());
    }

    public static CommandResult ok(Command command) {
        return create(StatusCode.OK, command);
    }

    public static CommandResult error(Command command, String detail) {
        return create(StatusCode.ERROR, command).setDetail(detail);
    }

    public static CommandResult noRoute(Command command) {
        return create(StatusCode.NO_ROUTE, command)
                .setDetail("No destination for command '%s'".formatted(command.getName()));
    }

    public static CommandResult aborted(long commandId, String commandName) {
        return new CommandResult(StatusCode.ABORTED, commandId, commandName)
                .setDetail("Engine stopped before the command was resolved");
    }

    @Override
    public MessageType getType() {
        return MessageType.CMD_RESULT;
    }

    @Override
    public CommandResult copy(boolean keepId) {
        return new CommandResult(this, keepId);
    }

    public boolean isSuccess() {
        return statusCode == StatusCode.OK;
    }

    public CommandResult setFinal(boolean isFinal) {
        this.isFinal = isFinal;
        return this;
    }

    public CommandResult setDetail(String detail) {
        this.detail = detail;
        return this;
    }

    void restoreIdentity(long id) {
        this.id = id;
    }

    @Override
    public String toString() {
        return "cmd_result{id=%d, in_response_to=%d, status=%s, final=%s}"
                .formatted(id, inResponseTo, statusCode, isFinal);
    }
}
