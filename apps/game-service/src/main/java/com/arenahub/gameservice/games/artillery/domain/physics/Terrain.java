package com.arenahub.gameservice.games.artillery.domain.physics;

import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.state.ArtilleryState;

/**
 * 高度图地形：每列一个地面 y 值，没有悬空结构。
 * 爆炸只会让地面变低（数值变大）；只有钢梁、喷灯、钻头这三种工具会直接改写。
 */
public final class Terrain {

    private Terrain() {
    }

    /**
     * 三层正弦叠加的起伏地形，四个出生区附近压平，最后做三遍平滑。
     */
    public static int[] generate(int width, int height, SeededRandom rng) {
        int[] ground = new int[width];
        double base = height * 0.55;
        double section = width / 4.0;
        for (int x = 0; x < width; x++) {
            double h = base;
            h += Math.sin(x / 80.0 + rng.nextDouble() * 0.1) * 60;
            h += Math.sin(x / 30.0 + rng.nextDouble() * 0.05) * 25;
            h += Math.sin(x / 12.0 + rng.nextDouble() * 0.02) * 10;

            // 出生区平台
            double center = (Math.floor(x / section) + 0.5) * section;
            double dist = Math.abs(x - center);
            if (dist < 30) {
                double flat = 1 - dist / 30;
                h = h * (1 - flat * 0.3) + base * flat * 0.3;
            }
            ground[x] = (int) Math.floor(Math.max(height * 0.2, Math.min(height * 0.85, h)));
        }
        for (int pass = 0; pass < 3; pass++) {
            for (int x = 1; x < width - 1; x++) {
                ground[x] = Math.floorDiv(ground[x - 1] + ground[x] * 2 + ground[x + 1], 4);
            }
        }
        return ground;
    }

    /**
     * 圆形弹坑：每列取圆与该列的弦，弦底低于地面时把地面压到弦底。
     */
    public static void carveCrater(ArtilleryState s, double cx, double cy, double radius) {
        int[] ground = s.getGround();
        for (int x = (int) Math.floor(cx - radius); x <= (int) Math.floor(cx + radius); x++) {
            if (x < 0 || x >= s.getWidth()) continue;
            double dx = x - cx;
            double halfChord = Math.sqrt(Math.max(0, radius * radius - dx * dx));
            double bottom = cy + halfChord;
            if (bottom > ground[x]) {
                ground[x] = (int) Math.floor(Math.min(s.getHeight(), bottom));
            }
        }
    }

    /** 钢梁：以 (gx, gy) 为中心填出一段平台，只会抬高地面 */
    public static void placeGirder(ArtilleryState s, double gx, double gy, int halfWidth) {
        int[] ground = s.getGround();
        int top = (int) Math.max(0, Math.floor(gy));
        int center = (int) Math.floor(gx);
        for (int x = center - halfWidth; x < center + halfWidth; x++) {
            if (x >= 0 && x < s.getWidth() && top < ground[x]) {
                ground[x] = top;
            }
        }
    }

    /** 喷灯：沿朝向挖出一条与虫子等高的横向通道 */
    public static void tunnel(ArtilleryState s, double fromX, double y, int dir, int length) {
        int[] ground = s.getGround();
        for (int i = 0; i < length; i++) {
            int x = (int) Math.floor(fromX + i * dir);
            if (x >= 0 && x < s.getWidth() && ground[x] <= y + 5) {
                ground[x] = (int) Math.min(s.getHeight(), Math.floor(y + 6));
            }
        }
    }

    /** 钻头：向下挖一条三列宽的竖井 */
    public static void drill(ArtilleryState s, double x, double y, int depth) {
        int[] ground = s.getGround();
        int cx = (int) Math.floor(x);
        for (int i = 0; i < depth; i++) {
            int dy = (int) Math.floor(y + i);
            if (dy >= s.getHeight()) break;
            for (int w = -1; w <= 1; w++) {
                int col = cx + w;
                if (col >= 0 && col < s.getWidth() && ground[col] <= dy) {
                    ground[col] = dy + 1;
                }
            }
        }
    }
}
