package streamtrace.config;

public enum ConfigOrigin {
  /** configurations that are set through environment variables */
  ENV("env_var"),
  /** configurations that are set through JVM properties */
  JVM_PROP("jvm_prop"),
  /** configurations that are set through the customer application */
  CODE("code"),
  /** set when the user has not set any configuration for the key (defaults to a value) */
  DEFAULT("default");

  public final String value;

  ConfigOrigin(String value) {
    this.value = value;
  }
}
