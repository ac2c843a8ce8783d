package software.amazon.wfst;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  // The empty symbol. Consumes and produces nothing.
  final static String EPSILON = "";

  // Stands for any symbol outside the alphabet, both on transitions and in tokenized input.
  final static String WILDCARD = ".";

  // Reserved rule-set name of the accepting state in a right-linear grammar.
  final static String FINAL_SYMBOL = "#";

  final static String DEFAULT_START_SYMBOL = "Start";

  final static double NOT_FINAL = Double.POSITIVE_INFINITY;
}
