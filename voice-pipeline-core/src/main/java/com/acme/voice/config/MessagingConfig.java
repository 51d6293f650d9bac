package com.acme.voice.config;

import java.util.Locale;

/**
 * Configuration for queue naming patterns. Pure POJO - no framework dependencies.
 */
public class MessagingConfig {

  private QueueNaming queueNaming = new QueueNaming();
  private String conversionCommand = "BimConversion";

  public QueueNaming getQueueNaming() {
    return queueNaming;
  }

  public void setQueueNaming(QueueNaming queueNaming) {
    this.queueNaming = queueNaming;
  }

  public String getConversionCommand() {
    return conversionCommand;
  }

  public void setConversionCommand(String conversionCommand) {
    this.conversionCommand = conversionCommand;
  }

  /** Queue the BIM conversion jobs are sent to, e.g. APP.CMD.BIMCONVERSION.Q */
  public String conversionQueue() {
    return queueNaming.buildCommandQueue(conversionCommand);
  }

  public static class QueueNaming {
    private String commandPrefix = "APP.CMD.";
    private String queueSuffix = ".Q";

    public String getCommandPrefix() {
      return commandPrefix;
    }

    public void setCommandPrefix(String commandPrefix) {
      this.commandPrefix = commandPrefix;
    }

    public String getQueueSuffix() {
      return queueSuffix;
    }

    public void setQueueSuffix(String queueSuffix) {
      this.queueSuffix = queueSuffix;
    }

    /**
     * Build a command queue name from a command name. Example: BimConversion ->
     * APP.CMD.BIMCONVERSION.Q (IBM MQ uses uppercase)
     */
    public String buildCommandQueue(String commandName) {
      return commandPrefix + commandName.toUpperCase(Locale.ROOT) + queueSuffix;
    }
  }
}
