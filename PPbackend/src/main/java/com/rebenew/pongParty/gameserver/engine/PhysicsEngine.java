package com.rebenew.pongParty.gameserver.engine;

import com.rebenew.pongParty.gameserver.config.GameProperties;
import com.rebenew.pongParty.gameserver.model.GameState;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Física del juego: avanza una pelota y dos palas un tick.
 * <p>
 * No guarda estado propio ni hace I/O; el único no determinismo es el
 * {@link Random} que recibe para el saque tras un punto.
 * <p>
 * Orden fijo por tick: integración, paredes, pala izquierda, pala derecha,
 * límites. Sin sub-pasos ni cooldown de colisión: una pelota lenta que sigue
 * dentro de la zona de la pala vuelve a disparar la colisión en el tick
 * siguiente.
 */
@Component
public class PhysicsEngine {

    private final GameProperties.Game game;

    public PhysicsEngine(GameProperties properties) {
        this.game = properties.getGame();
    }

    // Estado inicial: pelota centrada con signos aleatorios, palas centradas
    public GameState newGameState(Random random) {
        GameState state = new GameState();
        double paddleY = game.getBoardHeight() / 2 - game.getPaddleHeight() / 2;
        state.getPaddles().getLeft().setY(paddleY);
        state.getPaddles().getRight().setY(paddleY);
        resetBall(state, random);
        return state;
    }

    public TickOutcome advance(GameState state, Random random) {
        GameState.Ball ball = state.getBall();
        GameState.Paddles paddles = state.getPaddles();

        ball.setX(ball.getX() + ball.getDx());
        ball.setY(ball.getY() + ball.getDy());

        // Reflexión sin clamp: la pelota puede solaparse con la pared hasta un tick
        if (ball.getY() <= 0 || ball.getY() >= game.getBoardHeight() - game.getBallSize()) {
            ball.setDy(-ball.getDy());
        }

        GameState.Paddle left = paddles.getLeft();
        if (ball.getX() <= game.getPaddleWidth() && withinPaddle(ball, left)) {
            ball.setDx(Math.abs(ball.getDx()));
            ball.setDy(deflection(ball, left));
        }

        GameState.Paddle right = paddles.getRight();
        if (ball.getX() >= game.getBoardWidth() - game.getPaddleWidth() - game.getBallSize()
                && withinPaddle(ball, right)) {
            ball.setDx(-Math.abs(ball.getDx()));
            ball.setDy(deflection(ball, right));
        }

        if (ball.getX() < 0) {
            state.getScore().setRight(state.getScore().getRight() + 1);
            resetBall(state, random);
            return TickOutcome.RIGHT_SCORED;
        }
        if (ball.getX() > game.getBoardWidth()) {
            state.getScore().setLeft(state.getScore().getLeft() + 1);
            resetBall(state, random);
            return TickOutcome.LEFT_SCORED;
        }
        return TickOutcome.NONE;
    }

    public void resetBall(GameState state, Random random) {
        GameState.Ball ball = state.getBall();
        double speed = game.getBallSpeed();
        ball.setX(game.getBoardWidth() / 2);
        ball.setY(game.getBoardHeight() / 2);
        ball.setDx(random.nextBoolean() ? speed : -speed);
        ball.setDy(random.nextBoolean() ? speed : -speed);
    }

    public double clampPaddle(double y) {
        return Math.max(0, Math.min(game.maxPaddleY(), y));
    }

    private boolean withinPaddle(GameState.Ball ball, GameState.Paddle paddle) {
        return ball.getY() >= paddle.getY() && ball.getY() <= paddle.getY() + game.getPaddleHeight();
    }

    // Centro de la pala = tiro recto, bordes = ángulo máximo
    private double deflection(GameState.Ball ball, GameState.Paddle paddle) {
        double hitPos = (ball.getY() - paddle.getY()) / game.getPaddleHeight();
        return (hitPos - 0.5) * game.getBallSpeed() * 2;
    }
}
