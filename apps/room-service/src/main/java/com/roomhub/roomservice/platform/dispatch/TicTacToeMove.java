package com.roomhub.roomservice.platform.dispatch;

/** 井字棋落子，cellIndex = row * 3 + col */
public record TicTacToeMove(int cellIndex) implements GameAction {
}
